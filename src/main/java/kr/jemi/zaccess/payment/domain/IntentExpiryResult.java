package kr.jemi.zaccess.payment.domain;

public record IntentExpiryResult(int cancelled, int found) {
}

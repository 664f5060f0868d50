package kr.jemi.zaccess.payment.api;

public record IntentSweep(int cancelled, int found) {
}

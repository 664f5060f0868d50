package kr.jemi.zaccess.payment.domain;

/**
 * @param duplicate 이미 처리한 웹훅이면 true. 응답은 성공으로 돌려준다
 * @param applied   예매나 결제 요청의 상태가 이번 웹훅으로 바뀌었으면 true
 */
public record WebhookOutcome(boolean duplicate, boolean applied) {

    public static WebhookOutcome duplicated() {
        return new WebhookOutcome(true, false);
    }

    public static WebhookOutcome processed(boolean applied) {
        return new WebhookOutcome(false, applied);
    }
}

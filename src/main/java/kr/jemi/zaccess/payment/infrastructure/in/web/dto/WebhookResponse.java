package kr.jemi.zaccess.payment.infrastructure.in.web.dto;

import kr.jemi.zaccess.payment.domain.WebhookOutcome;

public record WebhookResponse(String orderId, boolean duplicate, boolean applied) {

    public static WebhookResponse of(String orderId, WebhookOutcome outcome) {
        return new WebhookResponse(orderId, outcome.duplicate(), outcome.applied());
    }
}

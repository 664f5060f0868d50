package kr.jemi.zaccess.payment.application.port.in;

import jakarta.validation.constraints.NotBlank;
import kr.jemi.zaccess.common.validation.SelfValidating;

public record ReceiveWebhookCommand(
        @NotBlank String orderId,
        @NotBlank String transactionStatus,
        String signatureKey,
        String payload
) implements SelfValidating {

    public ReceiveWebhookCommand(String orderId, String transactionStatus, String signatureKey, String payload) {
        this.orderId = orderId;
        this.transactionStatus = transactionStatus;
        this.signatureKey = signatureKey;
        this.payload = payload;
        validateSelf();
    }
}

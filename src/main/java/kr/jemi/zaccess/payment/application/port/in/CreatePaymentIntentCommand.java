package kr.jemi.zaccess.payment.application.port.in;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zaccess.common.validation.SelfValidating;

public record CreatePaymentIntentCommand(
        @NotBlank String userId,
        long accessTierId,
        @Min(1) int quantity,
        @NotBlank String idempotencyKey
) implements SelfValidating {

    public CreatePaymentIntentCommand(String userId, long accessTierId, int quantity, String idempotencyKey) {
        this.userId = userId;
        this.accessTierId = accessTierId;
        this.quantity = quantity;
        this.idempotencyKey = idempotencyKey;
        validateSelf();
    }
}

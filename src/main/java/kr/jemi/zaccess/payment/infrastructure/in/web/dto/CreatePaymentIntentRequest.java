package kr.jemi.zaccess.payment.infrastructure.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreatePaymentIntentRequest(
        @NotNull Long accessTierId,
        @Min(1) @Max(10) int quantity,
        @NotBlank @Size(max = 128) String idempotencyKey
) {
}

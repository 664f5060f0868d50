package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ReserveStockRequest(
        @NotNull Long accessTierId,
        @Min(1) @Max(10) int quantity,
        Long paymentIntentId,
        @Min(1) @Max(60) Integer ttlMinutes
) {
}

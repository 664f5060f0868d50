package kr.jemi.zaccess.booking.infrastructure.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record CheckoutRequest(
        @NotNull Long accessTierId,
        @Min(1) @Max(10) int quantity,
        Long stockReservationId
) {
}

package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CreateAccessTierRequest(
        @NotNull Long eventId,
        @NotBlank String name,
        @NotNull @PositiveOrZero BigDecimal price,
        @Min(1) int totalQuantity
) {
}

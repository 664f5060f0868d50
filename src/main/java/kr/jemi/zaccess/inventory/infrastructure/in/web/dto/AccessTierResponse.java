package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

import kr.jemi.zaccess.inventory.domain.AccessTier;

import java.math.BigDecimal;

public record AccessTierResponse(long accessTierId, long eventId, String name, BigDecimal price,
                                 int totalQuantity, int availableQuantity) {

    public static AccessTierResponse from(AccessTier tier) {
        return new AccessTierResponse(
                tier.getId(),
                tier.getEventId(),
                tier.getName(),
                tier.getPrice(),
                tier.getTotalQuantity(),
                tier.getAvailableQuantity()
        );
    }
}

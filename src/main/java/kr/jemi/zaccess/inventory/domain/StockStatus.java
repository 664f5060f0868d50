package kr.jemi.zaccess.inventory.domain;

public record StockStatus(
        long accessTierId,
        int totalQuantity,
        int soldQuantity,
        int reservedQuantity,
        int availableQuantity,
        long activeReservationCount,
        double utilizationRate
) {

    public static StockStatus of(AccessTier tier, long activeReservationCount) {
        return new StockStatus(tier.getId(), tier.getTotalQuantity(), tier.getSoldQuantity(),
                tier.getReservedQuantity(), tier.getAvailableQuantity(), activeReservationCount,
                tier.utilizationRate());
    }
}

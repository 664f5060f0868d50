package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

import kr.jemi.zaccess.inventory.domain.StockStatus;

public record StockStatusResponse(long accessTierId, int totalQuantity, int soldQuantity,
                                  int reservedQuantity, int availableQuantity,
                                  long activeReservations, String utilizationRate) {

    public static StockStatusResponse from(StockStatus status) {
        return new StockStatusResponse(
                status.accessTierId(),
                status.totalQuantity(),
                status.soldQuantity(),
                status.reservedQuantity(),
                status.availableQuantity(),
                status.activeReservationCount(),
                String.format("%.2f%%", status.utilizationRate())
        );
    }
}

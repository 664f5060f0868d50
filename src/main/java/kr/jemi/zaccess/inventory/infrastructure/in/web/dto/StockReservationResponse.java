package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

import kr.jemi.zaccess.inventory.domain.StockReservation;

import java.time.LocalDateTime;

public record StockReservationResponse(long reservationId, long accessTierId, int quantity,
                                       String status, LocalDateTime expiresAt) {

    public static StockReservationResponse from(StockReservation reservation) {
        return new StockReservationResponse(
                reservation.getId(),
                reservation.getAccessTierId(),
                reservation.getQuantity(),
                reservation.getStatus().name(),
                reservation.getExpiresAt()
        );
    }
}

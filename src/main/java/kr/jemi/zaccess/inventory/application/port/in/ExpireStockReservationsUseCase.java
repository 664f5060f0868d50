package kr.jemi.zaccess.inventory.application.port.in;

import kr.jemi.zaccess.inventory.domain.ReservationExpiryResult;

public interface ExpireStockReservationsUseCase {

    ReservationExpiryResult expireReservations();
}

package kr.jemi.zaccess.inventory.application.port.in;

import kr.jemi.zaccess.inventory.domain.StockReservation;

public interface ReserveStockUseCase {

    StockReservation reserve(ReserveStockCommand command);
}

package kr.jemi.zaccess.booking.application.port.out;

import kr.jemi.zaccess.booking.domain.StockAllocation;

/**
 * 예매 트랜잭션 안에서 호출되어야 한다.
 */
public interface StockAllocationPort {

    StockAllocation allocate(long accessTierId, int quantity);

    StockAllocation commitReservation(long stockReservationId, String userId);

    void release(long accessTierId, int quantity);
}

package kr.jemi.zaccess.inventory.application.port.out;

import kr.jemi.zaccess.inventory.domain.StockReservation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface StockReservationPort {

    StockReservation insert(StockReservation reservation);

    StockReservation update(StockReservation reservation);

    Optional<StockReservation> findById(long id);

    /** RESERVED 상태이면서 now 이전에 만료된 선점 id. 만료 시각 오름차순 */
    List<Long> findExpiredIds(LocalDateTime now, int limit);

    long countActiveByAccessTierId(long accessTierId);
}

package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import kr.jemi.zaccess.inventory.domain.StockReservationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface StockReservationJpaRepository extends JpaRepository<StockReservationJpaEntity, Long> {

    @Query("select r.id from StockReservationJpaEntity r "
            + "where r.status = :status and r.expiresAt < :now order by r.expiresAt")
    List<Long> findIdsByStatusAndExpiresAtBefore(@Param("status") StockReservationStatus status,
                                                 @Param("now") LocalDateTime now,
                                                 Pageable pageable);

    long countByAccessTierIdAndStatus(Long accessTierId, StockReservationStatus status);
}

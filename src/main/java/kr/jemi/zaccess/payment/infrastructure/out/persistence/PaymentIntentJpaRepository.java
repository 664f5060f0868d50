package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import kr.jemi.zaccess.payment.domain.PaymentIntentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PaymentIntentJpaRepository extends JpaRepository<PaymentIntentJpaEntity, Long> {

    Optional<PaymentIntentJpaEntity> findByOrderId(String orderId);

    Optional<PaymentIntentJpaEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<PaymentIntentJpaEntity> findByActiveLockKey(String activeLockKey);

    @Query("select p.id from PaymentIntentJpaEntity p "
            + "where p.status in :statuses and p.expiresAt < :now order by p.expiresAt")
    List<Long> findIdsByStatusInAndExpiresAtBefore(@Param("statuses") Collection<PaymentIntentStatus> statuses,
                                                   @Param("now") LocalDateTime now,
                                                   Pageable pageable);
}

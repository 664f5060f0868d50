package kr.jemi.zaccess.booking.infrastructure.out.persistence;

import kr.jemi.zaccess.booking.domain.BookingStatus;
import kr.jemi.zaccess.booking.domain.PaymentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BookingJpaRepository extends JpaRepository<BookingJpaEntity, Long> {

    Optional<BookingJpaEntity> findByBookingCode(String bookingCode);

    boolean existsByBookingCode(String bookingCode);

    @Query("select b.id from BookingJpaEntity b "
            + "where b.status = :status and b.paymentStatus = :paymentStatus and b.expiresAt < :now "
            + "order by b.expiresAt")
    List<Long> findExpiredIds(@Param("status") BookingStatus status,
                              @Param("paymentStatus") PaymentStatus paymentStatus,
                              @Param("now") LocalDateTime now,
                              Pageable pageable);

    @Query("select b.id from BookingJpaEntity b "
            + "where b.status = :status and b.paymentStatus = :paymentStatus "
            + "and b.expiryWarningAt is null and b.expiresAt >= :now and b.expiresAt <= :until "
            + "order by b.expiresAt")
    List<Long> findRemindableIds(@Param("status") BookingStatus status,
                                 @Param("paymentStatus") PaymentStatus paymentStatus,
                                 @Param("now") LocalDateTime now,
                                 @Param("until") LocalDateTime until,
                                 Pageable pageable);

    List<BookingJpaEntity> findByStatusAndPaymentStatusAndExpiresAtAfterOrderByCreatedAtDesc(
            BookingStatus status, PaymentStatus paymentStatus, LocalDateTime now, Pageable pageable);

    List<BookingJpaEntity> findByStatusInAndExpiresAtBetweenOrderByExpiresAtAsc(
            Collection<BookingStatus> statuses, LocalDateTime from, LocalDateTime to, Pageable pageable);

    @Query("select b.paymentStatus, count(b) from BookingJpaEntity b "
            + "where b.createdAt >= :from and b.createdAt < :to group by b.paymentStatus")
    List<Object[]> countGroupByPaymentStatus(@Param("from") LocalDateTime from,
                                             @Param("to") LocalDateTime to);
}

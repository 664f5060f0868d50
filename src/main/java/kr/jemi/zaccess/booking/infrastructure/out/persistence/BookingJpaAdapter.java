package kr.jemi.zaccess.booking.infrastructure.out.persistence;

import kr.jemi.zaccess.booking.application.port.out.BookingPort;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.BookingStatus;
import kr.jemi.zaccess.booking.domain.PaymentStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class BookingJpaAdapter implements BookingPort {

    private final BookingJpaRepository repository;

    public BookingJpaAdapter(BookingJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public Booking insert(Booking booking) {
        return repository.save(BookingJpaEntity.fromDomain(booking)).toDomain();
    }

    @Override
    public Booking update(Booking booking) {
        BookingJpaEntity entity = repository.findById(booking.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "예매를 찾을 수 없습니다: id=" + booking.getId()));
        if (!Objects.equals(entity.getVersion(), booking.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(BookingJpaEntity.class, booking.getId());
        }
        entity.update(booking);
        return repository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<Booking> findById(long id) {
        return repository.findById(id).map(BookingJpaEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByBookingCode(String bookingCode) {
        return repository.findByBookingCode(bookingCode).map(BookingJpaEntity::toDomain);
    }

    @Override
    public boolean existsByBookingCode(String bookingCode) {
        return repository.existsByBookingCode(bookingCode);
    }

    @Override
    public List<Long> findExpiredPendingIds(LocalDateTime now, int limit) {
        return repository.findExpiredIds(BookingStatus.PENDING, PaymentStatus.PENDING, now,
                PageRequest.of(0, limit));
    }

    @Override
    public List<Long> findRemindableIds(LocalDateTime now, LocalDateTime until, int limit) {
        return repository.findRemindableIds(BookingStatus.PENDING, PaymentStatus.PENDING, now, until,
                PageRequest.of(0, limit));
    }

    @Override
    public List<Booking> findAwaitingPayment(LocalDateTime now, int limit) {
        return repository.findByStatusAndPaymentStatusAndExpiresAtAfterOrderByCreatedAtDesc(
                        BookingStatus.PENDING, PaymentStatus.PENDING, now, PageRequest.of(0, limit))
                .stream()
                .map(BookingJpaEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findOverdueUnpaid(LocalDateTime from, LocalDateTime now, int limit) {
        return repository.findByStatusInAndExpiresAtBetweenOrderByExpiresAtAsc(
                        List.of(BookingStatus.PENDING, BookingStatus.EXPIRED), from, now, PageRequest.of(0, limit))
                .stream()
                .map(BookingJpaEntity::toDomain)
                .toList();
    }

    @Override
    public Map<PaymentStatus, Long> countByPaymentStatus(LocalDateTime createdFrom, LocalDateTime createdTo) {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        for (Object[] row : repository.countGroupByPaymentStatus(createdFrom, createdTo)) {
            counts.put((PaymentStatus) row[0], (Long) row[1]);
        }
        return counts;
    }
}

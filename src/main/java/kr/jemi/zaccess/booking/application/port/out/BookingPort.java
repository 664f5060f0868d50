package kr.jemi.zaccess.booking.application.port.out;

import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.PaymentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface BookingPort {

    Booking insert(Booking booking);

    Booking update(Booking booking);

    Optional<Booking> findById(long id);

    Optional<Booking> findByBookingCode(String bookingCode);

    boolean existsByBookingCode(String bookingCode);

    /** PENDING/PENDING이면서 결제 기한이 now 이전인 예매 id. 기한 오름차순 */
    List<Long> findExpiredPendingIds(LocalDateTime now, int limit);

    /** PENDING/PENDING, 알림 미발송, 기한이 [now, until] 구간인 예매 id. 기한 오름차순 */
    List<Long> findRemindableIds(LocalDateTime now, LocalDateTime until, int limit);

    /** PENDING/PENDING이면서 기한이 남은 예매. 생성 시각 내림차순 */
    List<Booking> findAwaitingPayment(LocalDateTime now, int limit);

    /** 기한이 [from, now] 구간이고 PENDING이거나 EXPIRED인 예매. 기한 오름차순 */
    List<Booking> findOverdueUnpaid(LocalDateTime from, LocalDateTime now, int limit);

    Map<PaymentStatus, Long> countByPaymentStatus(LocalDateTime createdFrom, LocalDateTime createdTo);
}

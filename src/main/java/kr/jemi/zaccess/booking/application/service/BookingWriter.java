package kr.jemi.zaccess.booking.application.service;

import kr.jemi.zaccess.booking.application.port.out.BookingPort;
import kr.jemi.zaccess.booking.application.port.out.StockAllocationPort;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.PaymentStatus;
import kr.jemi.zaccess.booking.domain.StockAllocation;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 예매 상태 전이와 재고 변경을 한 트랜잭션으로 묶는다.
 * 도메인 이벤트는 같은 트랜잭션에서 발행되어 이벤트 발행 레지스트리에 함께 기록된다.
 */
@Service
public class BookingWriter {

    private final BookingPort bookingPort;
    private final StockAllocationPort stockAllocationPort;
    private final ApplicationEventPublisher eventPublisher;

    public BookingWriter(BookingPort bookingPort,
                         StockAllocationPort stockAllocationPort,
                         ApplicationEventPublisher eventPublisher) {
        this.bookingPort = bookingPort;
        this.stockAllocationPort = stockAllocationPort;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public Booking checkout(long id, String bookingCode, String userId, long accessTierId, int quantity,
                            Long stockReservationId, Duration paymentWindow, LocalDateTime now) {
        StockAllocation allocation = stockReservationId != null
                ? commitReservation(stockReservationId, userId, accessTierId, quantity)
                : stockAllocationPort.allocate(accessTierId, quantity);
        Booking booking = Booking.create(id, bookingCode, userId, allocation, now.plus(paymentWindow), now);
        return bookingPort.insert(booking);
    }

    /**
     * 선점한 재고의 등급·수량이 요청과 다르면 거절한다. 예외로 트랜잭션이 롤백되어 선점은 그대로 남는다.
     */
    private StockAllocation commitReservation(long stockReservationId, String userId,
                                              long accessTierId, int quantity) {
        StockAllocation allocation = stockAllocationPort.commitReservation(stockReservationId, userId);
        if (allocation.accessTierId() != accessTierId || allocation.quantity() != quantity) {
            throw new BusinessException(ErrorCode.STOCK_RESERVATION_NOT_USABLE,
                    "선점과 요청 불일치: reservationId=" + stockReservationId
                            + ", 선점 tierId=" + allocation.accessTierId() + " quantity=" + allocation.quantity()
                            + ", 요청 tierId=" + accessTierId + " quantity=" + quantity);
        }
        return allocation;
    }

    @Transactional
    public boolean markPaid(String bookingCode, LocalDateTime now) {
        Booking booking = loadByCode(bookingCode);
        if (!booking.markPaid(now)) {
            return false;
        }
        save(booking);
        return true;
    }

    @Transactional
    public boolean cancel(String bookingCode, PaymentStatus paymentOutcome, LocalDateTime now) {
        Booking booking = loadByCode(bookingCode);
        if (!booking.cancel(paymentOutcome, now)) {
            return false;
        }
        stockAllocationPort.release(booking.getAccessTierId(), booking.getQuantity());
        save(booking);
        return true;
    }

    @Transactional
    public boolean expire(long bookingId, LocalDateTime now) {
        Booking booking = loadById(bookingId);
        if (!booking.expire(now)) {
            return false;
        }
        stockAllocationPort.release(booking.getAccessTierId(), booking.getQuantity());
        save(booking);
        return true;
    }

    @Transactional
    public boolean remind(long bookingId, LocalDateTime now, Duration reminderWindow) {
        Booking booking = loadById(bookingId);
        if (!booking.remind(now, reminderWindow)) {
            return false;
        }
        save(booking);
        return true;
    }

    private void save(Booking booking) {
        List<Object> events = booking.pullEvents();
        bookingPort.update(booking);
        events.forEach(eventPublisher::publishEvent);
    }

    private Booking loadByCode(String bookingCode) {
        return bookingPort.findByBookingCode(bookingCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND, bookingCode));
    }

    private Booking loadById(long bookingId) {
        return bookingPort.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "id=" + bookingId));
    }
}

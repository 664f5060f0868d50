package kr.jemi.zaccess.payment.infrastructure.out.booking;

import kr.jemi.zaccess.booking.api.BookingFacade;
import kr.jemi.zaccess.booking.api.PaymentStatusCounts;
import kr.jemi.zaccess.booking.api.PendingPayment;
import kr.jemi.zaccess.payment.application.port.out.BookingPaymentPort;
import kr.jemi.zaccess.payment.domain.PaymentStatusSummary;
import kr.jemi.zaccess.payment.domain.PendingBookingPayment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

@Component
public class BookingPaymentAdapter implements BookingPaymentPort {

    private final BookingFacade bookingFacade;

    public BookingPaymentAdapter(BookingFacade bookingFacade) {
        this.bookingFacade = bookingFacade;
    }

    @Override
    public boolean exists(String bookingCode) {
        return bookingFacade.exists(bookingCode);
    }

    @Override
    public List<PendingBookingPayment> findAwaitingPayment(int limit) {
        return bookingFacade.findAwaitingPayment(limit).stream()
                .map(BookingPaymentAdapter::toDomain)
                .toList();
    }

    @Override
    public List<PendingBookingPayment> findOverdueUnpaid(Duration lookback, int limit) {
        return bookingFacade.findOverdueUnpaid(lookback, limit).stream()
                .map(BookingPaymentAdapter::toDomain)
                .toList();
    }

    @Override
    public boolean confirmPayment(String bookingCode) {
        return bookingFacade.confirmPayment(bookingCode);
    }

    @Override
    public boolean isPaid(String bookingCode) {
        return bookingFacade.isPaid(bookingCode);
    }

    @Override
    public boolean failPayment(String bookingCode) {
        return bookingFacade.failPayment(bookingCode);
    }

    @Override
    public PaymentStatusSummary countPaymentStatuses(LocalDateTime from, LocalDateTime to) {
        PaymentStatusCounts counts = bookingFacade.countPaymentStatuses(from, to);
        return new PaymentStatusSummary(counts.pending(), counts.paid(), counts.failed(), counts.expired());
    }

    private static PendingBookingPayment toDomain(PendingPayment payment) {
        return new PendingBookingPayment(payment.bookingCode(), payment.userId(), payment.totalAmount(),
                payment.expiresAt(), payment.createdAt(), payment.expired());
    }
}

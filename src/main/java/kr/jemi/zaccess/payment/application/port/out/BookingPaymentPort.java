package kr.jemi.zaccess.payment.application.port.out;

import kr.jemi.zaccess.payment.domain.PaymentStatusSummary;
import kr.jemi.zaccess.payment.domain.PendingBookingPayment;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public interface BookingPaymentPort {

    boolean exists(String bookingCode);

    List<PendingBookingPayment> findAwaitingPayment(int limit);

    List<PendingBookingPayment> findOverdueUnpaid(Duration lookback, int limit);

    boolean confirmPayment(String bookingCode);

    boolean isPaid(String bookingCode);

    boolean failPayment(String bookingCode);

    PaymentStatusSummary countPaymentStatuses(LocalDateTime from, LocalDateTime to);
}

package kr.jemi.zaccess.booking.application.service;

import kr.jemi.zaccess.booking.application.port.in.HandleBookingNotificationUseCase;
import kr.jemi.zaccess.booking.application.port.out.BookingNotificationPort;
import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import kr.jemi.zaccess.booking.domain.PaymentReminderEvent;
import org.springframework.stereotype.Service;

@Service
public class BookingNotificationHandler implements HandleBookingNotificationUseCase {

    private final BookingNotificationPort bookingNotificationPort;

    public BookingNotificationHandler(BookingNotificationPort bookingNotificationPort) {
        this.bookingNotificationPort = bookingNotificationPort;
    }

    @Override
    public void handle(PaymentReminderEvent event) {
        bookingNotificationPort.sendPaymentReminder(event);
    }

    @Override
    public void handle(PaymentExpiredEvent event) {
        bookingNotificationPort.sendPaymentExpired(event);
    }
}

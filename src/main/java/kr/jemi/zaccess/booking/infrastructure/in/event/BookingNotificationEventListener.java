package kr.jemi.zaccess.booking.infrastructure.in.event;

import kr.jemi.zaccess.booking.application.port.in.HandleBookingNotificationUseCase;
import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import kr.jemi.zaccess.booking.domain.PaymentReminderEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class BookingNotificationEventListener {

    private final HandleBookingNotificationUseCase handleBookingNotificationUseCase;

    public BookingNotificationEventListener(HandleBookingNotificationUseCase handleBookingNotificationUseCase) {
        this.handleBookingNotificationUseCase = handleBookingNotificationUseCase;
    }

    @Async
    @TransactionalEventListener
    public void on(PaymentReminderEvent event) {
        handleBookingNotificationUseCase.handle(event);
    }

    @Async
    @TransactionalEventListener
    public void on(PaymentExpiredEvent event) {
        handleBookingNotificationUseCase.handle(event);
    }
}

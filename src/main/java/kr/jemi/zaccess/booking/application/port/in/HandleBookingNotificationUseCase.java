package kr.jemi.zaccess.booking.application.port.in;

import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import kr.jemi.zaccess.booking.domain.PaymentReminderEvent;

public interface HandleBookingNotificationUseCase {

    void handle(PaymentReminderEvent event);

    void handle(PaymentExpiredEvent event);
}

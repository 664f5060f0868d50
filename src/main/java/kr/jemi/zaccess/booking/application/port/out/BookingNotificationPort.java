package kr.jemi.zaccess.booking.application.port.out;

import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import kr.jemi.zaccess.booking.domain.PaymentReminderEvent;

public interface BookingNotificationPort {

    void sendPaymentReminder(PaymentReminderEvent event);

    void sendPaymentExpired(PaymentExpiredEvent event);
}

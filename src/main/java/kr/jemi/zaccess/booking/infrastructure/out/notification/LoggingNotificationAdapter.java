package kr.jemi.zaccess.booking.infrastructure.out.notification;

import kr.jemi.zaccess.booking.application.port.out.BookingNotificationPort;
import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import kr.jemi.zaccess.booking.domain.PaymentReminderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 푸시·이메일 발송은 별도 알림 시스템의 몫이다. 여기서는 발송 요청을 기록만 한다.
 */
@Component
public class LoggingNotificationAdapter implements BookingNotificationPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationAdapter.class);

    @Override
    public void sendPaymentReminder(PaymentReminderEvent event) {
        log.info("결제 기한 임박 알림 요청: userId={}, bookingCode={}, expiresAt={}",
                event.userId(), event.bookingCode(), event.eventContext().expiresAt());
    }

    @Override
    public void sendPaymentExpired(PaymentExpiredEvent event) {
        log.info("결제 기한 만료 알림 요청: userId={}, bookingCode={}, eventId={}",
                event.userId(), event.bookingCode(), event.eventContext().eventId());
    }
}

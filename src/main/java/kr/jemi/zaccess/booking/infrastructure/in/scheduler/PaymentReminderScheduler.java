package kr.jemi.zaccess.booking.infrastructure.in.scheduler;

import kr.jemi.zaccess.booking.application.port.in.SendPaymentRemindersUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PaymentReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(PaymentReminderScheduler.class);

    private final SendPaymentRemindersUseCase sendPaymentRemindersUseCase;

    public PaymentReminderScheduler(SendPaymentRemindersUseCase sendPaymentRemindersUseCase) {
        this.sendPaymentRemindersUseCase = sendPaymentRemindersUseCase;
    }

    @Scheduled(cron = "${zaccess.booking.reminder.cron}")
    @SchedulerLock(name = "sendPaymentReminders",
            lockAtMostFor = "${zaccess.booking.reminder.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.booking.reminder.lock-at-least-for}")
    public void remind() {
        try {
            sendPaymentRemindersUseCase.sendReminders();
        } catch (Exception e) {
            log.error("결제 알림 스케줄러 실패", e);
        }
    }
}

package kr.jemi.zaccess.payment.infrastructure.in.scheduler;

import kr.jemi.zaccess.payment.application.port.in.ReportPaymentStatsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PaymentStatsScheduler {

    private static final Logger log = LoggerFactory.getLogger(PaymentStatsScheduler.class);

    private final ReportPaymentStatsUseCase reportPaymentStatsUseCase;

    public PaymentStatsScheduler(ReportPaymentStatsUseCase reportPaymentStatsUseCase) {
        this.reportPaymentStatsUseCase = reportPaymentStatsUseCase;
    }

    @Scheduled(cron = "${zaccess.payment.stats.cron}")
    @SchedulerLock(name = "reportPaymentStats",
            lockAtMostFor = "${zaccess.payment.stats.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.payment.stats.lock-at-least-for}")
    public void report() {
        try {
            reportPaymentStatsUseCase.reportDailyStats();
        } catch (Exception e) {
            log.error("일일 결제 통계 스케줄러 실패", e);
        }
    }
}

package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.payment.application.port.in.ReportPaymentStatsUseCase;
import kr.jemi.zaccess.payment.application.port.out.BookingPaymentPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentAuditPort;
import kr.jemi.zaccess.payment.domain.PaymentStatsReport;
import kr.jemi.zaccess.payment.domain.PaymentStatusSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@Service
public class PaymentStatsService implements ReportPaymentStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentStatsService.class);

    static final String ANOMALY_EVENT = "PAYMENT_STATS_ANOMALY";

    private final BookingPaymentPort bookingPaymentPort;
    private final PaymentAuditPort paymentAuditPort;
    private final Clock clock;
    private final long pendingThreshold;
    private final long failedThreshold;

    public PaymentStatsService(BookingPaymentPort bookingPaymentPort,
                               PaymentAuditPort paymentAuditPort,
                               Clock clock,
                               @Value("${zaccess.payment.stats.pending-threshold}") long pendingThreshold,
                               @Value("${zaccess.payment.stats.failed-threshold}") long failedThreshold) {
        this.bookingPaymentPort = bookingPaymentPort;
        this.paymentAuditPort = paymentAuditPort;
        this.clock = clock;
        this.pendingThreshold = pendingThreshold;
        this.failedThreshold = failedThreshold;
    }

    @Override
    public PaymentStatsReport reportDailyStats() {
        LocalDate today = LocalDate.now(clock);
        LocalDate yesterday = today.minusDays(1);
        PaymentStatusSummary summary = bookingPaymentPort.countPaymentStatuses(
                yesterday.atStartOfDay(), today.atStartOfDay());
        PaymentStatsReport report = PaymentStatsReport.of(yesterday, summary, pendingThreshold, failedThreshold);

        log.info("일일 결제 통계 {}: 대기 {}, 완료 {}, 실패 {}, 만료 {} (총 {}건)", yesterday,
                summary.pending(), summary.paid(), summary.failed(), summary.expired(), summary.total());

        if (report.anomalous()) {
            log.warn("[ALERT] {} 결제 이상 징후: 대기 {}건 (임계 {}), 실패 {}건 (임계 {})", yesterday,
                    summary.pending(), pendingThreshold, summary.failed(), failedThreshold);
            paymentAuditPort.alert(ANOMALY_EVENT, yesterday + " 결제 대기·실패 건수 임계치 초과",
                    Map.of("date", yesterday.toString(),
                            "pending", summary.pending(),
                            "paid", summary.paid(),
                            "failed", summary.failed(),
                            "expired", summary.expired()));
        }
        return report;
    }
}

package kr.jemi.zaccess.payment.domain;

import java.time.LocalDate;

public record PaymentStatsReport(LocalDate date, PaymentStatusSummary summary, boolean anomalous) {

    /**
     * 대기 건수나 실패 건수 중 하나라도 임계치를 넘으면 이상 징후로 본다.
     */
    public static PaymentStatsReport of(LocalDate date, PaymentStatusSummary summary,
                                        long pendingThreshold, long failedThreshold) {
        boolean anomalous = summary.pending() > pendingThreshold || summary.failed() > failedThreshold;
        return new PaymentStatsReport(date, summary, anomalous);
    }
}

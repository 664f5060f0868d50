package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.PaymentStatsReport;

public interface ReportPaymentStatsUseCase {

    /** 전날 생성된 예매의 결제 상태 집계 */
    PaymentStatsReport reportDailyStats();
}

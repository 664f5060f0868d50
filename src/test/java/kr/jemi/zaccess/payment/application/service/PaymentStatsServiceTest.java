package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.payment.application.port.out.BookingPaymentPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentAuditPort;
import kr.jemi.zaccess.payment.domain.PaymentStatsReport;
import kr.jemi.zaccess.payment.domain.PaymentStatusSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentStatsServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDate TODAY = LocalDate.of(2025, 5, 1);
    private static final LocalDate YESTERDAY = TODAY.minusDays(1);

    @Mock
    private BookingPaymentPort bookingPaymentPort;

    @Mock
    private PaymentAuditPort paymentAuditPort;

    private PaymentStatsService service;

    @BeforeEach
    void setUp() {
        service = new PaymentStatsService(bookingPaymentPort, paymentAuditPort, CLOCK, 100, 50);
    }

    @Test
    @DisplayName("어제 00시부터 오늘 00시까지를 집계한다")
    void countsYesterday() {
        // given
        given(bookingPaymentPort.countPaymentStatuses(YESTERDAY.atStartOfDay(), TODAY.atStartOfDay()))
                .willReturn(new PaymentStatusSummary(3, 40, 2, 5));

        // when
        PaymentStatsReport report = service.reportDailyStats();

        // then
        assertThat(report.date()).isEqualTo(YESTERDAY);
        assertThat(report.summary().total()).isEqualTo(50);
        assertThat(report.anomalous()).isFalse();
        then(paymentAuditPort).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("실패 건수가 임계치를 넘으면 알림을 남긴다")
    void alertsOnFailedThreshold() {
        // given
        given(bookingPaymentPort.countPaymentStatuses(any(), any()))
                .willReturn(new PaymentStatusSummary(0, 10, 51, 0));

        // when
        PaymentStatsReport report = service.reportDailyStats();

        // then
        assertThat(report.anomalous()).isTrue();
        then(paymentAuditPort).should().alert(eq(PaymentStatsService.ANOMALY_EVENT), anyString(), anyMap());
    }

    @Test
    @DisplayName("임계치와 같으면 이상 징후가 아니다")
    void thresholdIsExclusive() {
        given(bookingPaymentPort.countPaymentStatuses(any(), any()))
                .willReturn(new PaymentStatusSummary(100, 0, 50, 0));

        assertThat(service.reportDailyStats().anomalous()).isFalse();
    }
}

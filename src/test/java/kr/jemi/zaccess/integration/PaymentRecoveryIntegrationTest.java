package kr.jemi.zaccess.integration;

import kr.jemi.zaccess.audit.domain.AuditLevel;
import kr.jemi.zaccess.audit.infrastructure.out.persistence.AuditLogJpaEntity;
import kr.jemi.zaccess.booking.application.port.in.CheckoutCommand;
import kr.jemi.zaccess.booking.application.port.in.CheckoutUseCase;
import kr.jemi.zaccess.booking.application.port.in.ExpireBookingsUseCase;
import kr.jemi.zaccess.booking.application.port.in.GetBookingUseCase;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.BookingStatus;
import kr.jemi.zaccess.booking.domain.SweepResult;
import kr.jemi.zaccess.inventory.application.port.in.GetStockStatusUseCase;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookCommand;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookUseCase;
import kr.jemi.zaccess.payment.application.port.in.RecoverMissedPaymentsUseCase;
import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;
import kr.jemi.zaccess.payment.domain.RecoveryResult;
import kr.jemi.zaccess.payment.domain.WebhookOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

class PaymentRecoveryIntegrationTest extends IntegrationTestBase {

    @Autowired
    CheckoutUseCase checkoutUseCase;

    @Autowired
    ExpireBookingsUseCase expireBookingsUseCase;

    @Autowired
    GetBookingUseCase getBookingUseCase;

    @Autowired
    GetStockStatusUseCase getStockStatusUseCase;

    @Autowired
    RecoverMissedPaymentsUseCase recoverMissedPaymentsUseCase;

    @Autowired
    ReceiveWebhookUseCase receiveWebhookUseCase;

    @Test
    @DisplayName("기한이 지났지만 아직 만료 처리 전인 예매는 게이트웨이 결제 완료를 확인해 PAID로 복구하고 알림을 남긴다")
    void recoversOverduePendingBooking() {
        // given
        AccessTier tier = createTier(5);
        Booking booking = checkoutUseCase.checkout(new CheckoutCommand("user-1", tier.getId(), 2));
        clock.advance(Duration.ofMinutes(40));
        given(paymentGatewayPort.checkStatus(anyString())).willReturn(GatewayTransactionStatus.SETTLEMENT);

        // when
        RecoveryResult result = recoverMissedPaymentsUseCase.recoverMissed().orElseThrow();

        // then
        assertThat(result).isEqualTo(new RecoveryResult(1, 0, 1));
        assertThat(getBookingUseCase.getBooking(booking.getBookingCode()).getStatus())
                .isEqualTo(BookingStatus.PAID);
        assertThat(getStockStatusUseCase.getStockStatus(tier.getId()).soldQuantity()).isEqualTo(2);
        assertThat(auditLogJpaRepository.findByEventType("PAYMENT_RECOVERY")).hasSize(1);
    }

    @Test
    @DisplayName("결제됐지만 웹훅을 놓쳐 이미 만료된 예매는 되돌리지 않고 CRITICAL 알림으로 드러낸다")
    void surfacesBookingPaidAfterExpiry() {
        // given
        AccessTier tier = createTier(5);
        Booking booking = checkoutUseCase.checkout(new CheckoutCommand("user-1", tier.getId(), 2));
        clock.advance(Duration.ofMinutes(31));
        SweepResult expired = expireBookingsUseCase.expireOverdue();
        given(paymentGatewayPort.checkStatus(anyString())).willReturn(GatewayTransactionStatus.SETTLEMENT);
        clock.advance(Duration.ofMinutes(28));

        // when
        RecoveryResult result = recoverMissedPaymentsUseCase.recoverMissed().orElseThrow();

        // then
        assertThat(expired.processed()).isEqualTo(1);
        assertThat(result).isEqualTo(new RecoveryResult(0, 1, 1));
        assertThat(getBookingUseCase.getBooking(booking.getBookingCode()).getStatus())
                .isEqualTo(BookingStatus.EXPIRED);
        assertThat(getStockStatusUseCase.getStockStatus(tier.getId()).availableQuantity()).isEqualTo(5);

        List<AuditLogJpaEntity> alerts = auditLogJpaRepository.findByEventType("PAYMENT_RECOVERY");
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getLevel()).isEqualTo(AuditLevel.CRITICAL);
        assertThat(alerts.get(0).getMetadata()).contains(booking.getBookingCode());
    }

    @Test
    @DisplayName("만료된 예매에 늦게 도착한 결제 완료 웹훅은 반영하지 않고 CRITICAL 알림을 남긴다")
    void latePaidWebhookOnExpiredBooking() {
        // given
        AccessTier tier = createTier(5);
        Booking booking = checkoutUseCase.checkout(new CheckoutCommand("user-1", tier.getId(), 2));
        clock.advance(Duration.ofMinutes(31));
        expireBookingsUseCase.expireOverdue();

        // when
        WebhookOutcome outcome = receiveWebhookUseCase.receive(new ReceiveWebhookCommand(
                booking.getBookingCode(), "settlement", "sig-1", "{}"));

        // then
        assertThat(outcome).isEqualTo(WebhookOutcome.processed(false));
        assertThat(getBookingUseCase.getBooking(booking.getBookingCode()).getStatus())
                .isEqualTo(BookingStatus.EXPIRED);
        List<AuditLogJpaEntity> alerts = auditLogJpaRepository.findByEventType("PAYMENT_AFTER_CLOSE");
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getLevel()).isEqualTo(AuditLevel.CRITICAL);
    }

    @Test
    @DisplayName("lookback보다 오래전에 만료된 예매는 복구 대상이 아니다")
    void outsideLookbackIgnored() {
        // given
        AccessTier tier = createTier(5);
        checkoutUseCase.checkout(new CheckoutCommand("user-1", tier.getId(), 1));
        clock.advance(Duration.ofMinutes(31));
        expireBookingsUseCase.expireOverdue();
        clock.advance(Duration.ofDays(2));

        // when
        RecoveryResult result = recoverMissedPaymentsUseCase.recoverMissed().orElseThrow();

        // then
        assertThat(result).isEqualTo(new RecoveryResult(0, 0, 0));
        assertThat(auditLogJpaRepository.findByEventType("PAYMENT_RECOVERY")).isEmpty();
    }
}

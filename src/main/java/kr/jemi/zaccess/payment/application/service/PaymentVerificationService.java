package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.common.concurrency.SingleFlight;
import kr.jemi.zaccess.payment.application.port.in.RecoverMissedPaymentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.VerifyPendingPaymentsUseCase;
import kr.jemi.zaccess.payment.application.port.out.BookingPaymentPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentAuditPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentGatewayPort;
import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;
import kr.jemi.zaccess.payment.domain.PendingBookingPayment;
import kr.jemi.zaccess.payment.domain.RecoveryResult;
import kr.jemi.zaccess.payment.domain.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 웹훅 유실에 대비해 게이트웨이 상태 조회로 결제 상태를 맞춘다.
 * verifyPending은 기한이 남은 예매를 자주 소량씩, recoverMissed는 기한이 지난 예매를 드물게 넓게 본다.
 */
@Service
public class PaymentVerificationService implements VerifyPendingPaymentsUseCase, RecoverMissedPaymentsUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentVerificationService.class);

    static final String VERIFY_JOB = "verifyPendingPayments";
    static final String RECOVER_JOB = "recoverMissedPayments";
    static final String RECOVERY_EVENT = "PAYMENT_RECOVERY";

    private final BookingPaymentPort bookingPaymentPort;
    private final PaymentGatewayPort paymentGatewayPort;
    private final PaymentAuditPort paymentAuditPort;
    private final SingleFlight singleFlight;
    private final int recoveryLimit;
    private final Duration recoveryLookback;

    public PaymentVerificationService(BookingPaymentPort bookingPaymentPort,
                                      PaymentGatewayPort paymentGatewayPort,
                                      PaymentAuditPort paymentAuditPort,
                                      SingleFlight singleFlight,
                                      @Value("${zaccess.payment.recovery.limit}") int recoveryLimit,
                                      @Value("${zaccess.payment.recovery.lookback}") Duration recoveryLookback) {
        this.bookingPaymentPort = bookingPaymentPort;
        this.paymentGatewayPort = paymentGatewayPort;
        this.paymentAuditPort = paymentAuditPort;
        this.singleFlight = singleFlight;
        this.recoveryLimit = recoveryLimit;
        this.recoveryLookback = recoveryLookback;
    }

    @Override
    public Optional<VerificationResult> verifyPending(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit은 1 이상이어야 합니다: " + limit);
        }
        return singleFlight.tryRun(VERIFY_JOB, () -> {
            List<PendingBookingPayment> targets = bookingPaymentPort.findAwaitingPayment(limit);
            int verified = 0;
            int failed = 0;
            int errors = 0;
            for (PendingBookingPayment target : targets) {
                try {
                    GatewayTransactionStatus status = paymentGatewayPort.checkStatus(target.bookingCode());
                    if (status.isSuccess() && bookingPaymentPort.confirmPayment(target.bookingCode())) {
                        verified++;
                    } else if (status.isFailure() && bookingPaymentPort.failPayment(target.bookingCode())) {
                        failed++;
                    }
                } catch (Exception e) {
                    errors++;
                    log.error("결제 상태 확인 실패: bookingCode={}", target.bookingCode(), e);
                }
            }
            if (!targets.isEmpty()) {
                log.info("결제 상태 확인: 완료 {}건, 실패 확정 {}건, 오류 {}건 / 대상 {}건",
                        verified, failed, errors, targets.size());
            }
            return new VerificationResult(verified, failed, errors, targets.size());
        });
    }

    @Override
    public Optional<RecoveryResult> recoverMissed() {
        return singleFlight.tryRun(RECOVER_JOB, () -> {
            List<PendingBookingPayment> targets =
                    bookingPaymentPort.findOverdueUnpaid(recoveryLookback, recoveryLimit);
            int recovered = 0;
            List<String> paidAfterExpiry = new ArrayList<>();
            for (PendingBookingPayment target : targets) {
                try {
                    GatewayTransactionStatus status = paymentGatewayPort.checkStatus(target.bookingCode());
                    if (!status.isSuccess()) {
                        continue;
                    }
                    if (target.expired()) {
                        paidAfterExpiry.add(target.bookingCode());
                        log.warn("만료된 예매에 결제 완료 확인: bookingCode={}", target.bookingCode());
                    } else if (bookingPaymentPort.confirmPayment(target.bookingCode())) {
                        recovered++;
                        log.info("누락된 결제 복구: bookingCode={}", target.bookingCode());
                    }
                } catch (Exception e) {
                    log.error("누락 결제 확인 실패: bookingCode={}", target.bookingCode(), e);
                }
            }
            RecoveryResult result = new RecoveryResult(recovered, paidAfterExpiry.size(), targets.size());
            if (result.needsAttention()) {
                alertRecovered(result, paidAfterExpiry);
            }
            return result;
        });
    }

    /**
     * 복구 건이 있다는 것은 웹훅과 상태 확인이 모두 놓쳤다는 뜻이므로 운영자에게 알린다.
     * 만료 후 결제된 예매는 재고가 이미 반환되어 수동 처리(환불 또는 재배정)가 필요하다.
     */
    private void alertRecovered(RecoveryResult result, List<String> paidAfterExpiry) {
        log.warn("[ALERT] 웹훅·상태 확인으로 처리되지 않은 결제: 복구 {}건, 만료 후 결제 {}건 {} (확인 {}건). "
                        + "웹훅 수신 상태를 점검하세요",
                result.recovered(), result.paidAfterExpiry(), paidAfterExpiry, result.checked());
        try {
            paymentAuditPort.alert(RECOVERY_EVENT,
                    "누락된 결제 " + result.recovered() + "건 복구, 만료 후 결제 " + result.paidAfterExpiry() + "건",
                    Map.of("recovered", result.recovered(),
                            "paidAfterExpiry", result.paidAfterExpiry(),
                            "paidAfterExpiryBookingCodes", paidAfterExpiry,
                            "checked", result.checked()));
        } catch (Exception e) {
            log.error("결제 복구 감사 로그 기록 실패", e);
        }
    }
}

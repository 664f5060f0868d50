package kr.jemi.zaccess.payment.infrastructure.in.scheduler;

import kr.jemi.zaccess.payment.application.port.in.RecoverMissedPaymentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.VerifyPendingPaymentsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PaymentVerificationScheduler {

    private static final Logger log = LoggerFactory.getLogger(PaymentVerificationScheduler.class);

    private final VerifyPendingPaymentsUseCase verifyPendingPaymentsUseCase;
    private final RecoverMissedPaymentsUseCase recoverMissedPaymentsUseCase;
    private final int verificationLimit;

    public PaymentVerificationScheduler(VerifyPendingPaymentsUseCase verifyPendingPaymentsUseCase,
                                        RecoverMissedPaymentsUseCase recoverMissedPaymentsUseCase,
                                        @Value("${zaccess.payment.verification.limit}") int verificationLimit) {
        this.verifyPendingPaymentsUseCase = verifyPendingPaymentsUseCase;
        this.recoverMissedPaymentsUseCase = recoverMissedPaymentsUseCase;
        this.verificationLimit = verificationLimit;
    }

    @Scheduled(cron = "${zaccess.payment.verification.cron}")
    @SchedulerLock(name = "verifyPendingPayments",
            lockAtMostFor = "${zaccess.payment.verification.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.payment.verification.lock-at-least-for}")
    public void verify() {
        try {
            verifyPendingPaymentsUseCase.verifyPending(verificationLimit);
        } catch (Exception e) {
            log.error("결제 상태 확인 스케줄러 실패", e);
        }
    }

    @Scheduled(cron = "${zaccess.payment.recovery.cron}")
    @SchedulerLock(name = "recoverMissedPayments",
            lockAtMostFor = "${zaccess.payment.recovery.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.payment.recovery.lock-at-least-for}")
    public void recover() {
        try {
            recoverMissedPaymentsUseCase.recoverMissed();
        } catch (Exception e) {
            log.error("누락 결제 복구 스케줄러 실패", e);
        }
    }
}

package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.VerificationResult;

import java.util.Optional;

public interface VerifyPendingPaymentsUseCase {

    Optional<VerificationResult> verifyPending(int limit);
}

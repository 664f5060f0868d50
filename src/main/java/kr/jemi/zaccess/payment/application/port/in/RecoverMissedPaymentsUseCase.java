package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.RecoveryResult;

import java.util.Optional;

public interface RecoverMissedPaymentsUseCase {

    Optional<RecoveryResult> recoverMissed();
}

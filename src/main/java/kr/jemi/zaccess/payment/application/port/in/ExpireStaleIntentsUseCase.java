package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.IntentExpiryResult;

import java.util.Optional;

public interface ExpireStaleIntentsUseCase {

    /**
     * @return 이전 실행이 아직 진행 중이면 {@link Optional#empty()}
     */
    Optional<IntentExpiryResult> expireStaleIntents();
}

package kr.jemi.zaccess.payment.api;

import java.util.Optional;

public interface PaymentFacade {

    /**
     * @return 이전 실행이 아직 진행 중이면 {@link Optional#empty()}
     */
    Optional<IntentSweep> expireStaleIntents();

    int purgeWebhookLogs();
}

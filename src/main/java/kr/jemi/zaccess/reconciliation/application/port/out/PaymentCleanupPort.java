package kr.jemi.zaccess.reconciliation.application.port.out;

import kr.jemi.zaccess.reconciliation.domain.TaskCount;

import java.util.Optional;

public interface PaymentCleanupPort {

    /** 이전 실행이 진행 중이면 {@link Optional#empty()} */
    Optional<TaskCount> expireStaleIntents();

    TaskCount purgeWebhookLogs();
}

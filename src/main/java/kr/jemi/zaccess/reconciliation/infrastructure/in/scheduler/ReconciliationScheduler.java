package kr.jemi.zaccess.reconciliation.infrastructure.in.scheduler;

import kr.jemi.zaccess.reconciliation.application.port.in.RunReconciliationCycleUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final RunReconciliationCycleUseCase runReconciliationCycleUseCase;

    public ReconciliationScheduler(RunReconciliationCycleUseCase runReconciliationCycleUseCase) {
        this.runReconciliationCycleUseCase = runReconciliationCycleUseCase;
    }

    @Scheduled(cron = "${zaccess.reconciliation.cron}")
    @SchedulerLock(name = "reconciliationCycle",
            lockAtMostFor = "${zaccess.reconciliation.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.reconciliation.lock-at-least-for}")
    public void reconcile() {
        try {
            runReconciliationCycleUseCase.runCycle();
        } catch (Exception e) {
            log.error("정리 사이클 스케줄러 실패", e);
        }
    }
}

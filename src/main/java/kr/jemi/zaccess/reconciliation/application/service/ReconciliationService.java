package kr.jemi.zaccess.reconciliation.application.service;

import kr.jemi.zaccess.common.concurrency.SingleFlight;
import kr.jemi.zaccess.reconciliation.application.port.in.RunReconciliationCycleUseCase;
import kr.jemi.zaccess.reconciliation.application.port.out.AuditCleanupPort;
import kr.jemi.zaccess.reconciliation.application.port.out.BookingCleanupPort;
import kr.jemi.zaccess.reconciliation.application.port.out.InventoryCleanupPort;
import kr.jemi.zaccess.reconciliation.application.port.out.PaymentCleanupPort;
import kr.jemi.zaccess.reconciliation.domain.CleanupTask;
import kr.jemi.zaccess.reconciliation.domain.CycleReport;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;
import kr.jemi.zaccess.reconciliation.domain.TaskOutcome;
import kr.jemi.zaccess.reconciliation.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 정리 작업들을 전용 풀에서 동시에 실행하고 모두 끝날 때까지 기다린다.
 * 사이클 안에서는 재시도하지 않는다. 실패한 작업은 다음 사이클에서 다시 실행된다.
 */
@Service
public class ReconciliationService implements RunReconciliationCycleUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    static final String CYCLE_JOB = "reconciliationCycle";

    private final PaymentCleanupPort paymentCleanupPort;
    private final InventoryCleanupPort inventoryCleanupPort;
    private final BookingCleanupPort bookingCleanupPort;
    private final AuditCleanupPort auditCleanupPort;
    private final SingleFlight singleFlight;
    private final Executor executor;
    private final Clock clock;

    public ReconciliationService(PaymentCleanupPort paymentCleanupPort,
                                 InventoryCleanupPort inventoryCleanupPort,
                                 BookingCleanupPort bookingCleanupPort,
                                 AuditCleanupPort auditCleanupPort,
                                 SingleFlight singleFlight,
                                 @Qualifier("reconciliationExecutor") Executor executor,
                                 Clock clock) {
        this.paymentCleanupPort = paymentCleanupPort;
        this.inventoryCleanupPort = inventoryCleanupPort;
        this.bookingCleanupPort = bookingCleanupPort;
        this.auditCleanupPort = auditCleanupPort;
        this.singleFlight = singleFlight;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public Optional<CycleReport> runCycle() {
        return singleFlight.tryRun(CYCLE_JOB, this::executeCycle);
    }

    private CycleReport executeCycle() {
        LocalDateTime startedAt = LocalDateTime.now(clock);

        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>();
        for (CleanupTask task : CleanupTask.values()) {
            futures.add(submit(task));
        }
        List<TaskOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        CycleReport report = new CycleReport(startedAt, outcomes,
                Duration.between(startedAt, LocalDateTime.now(clock)));
        logSummary(report);
        recordAudit(report);
        return report;
    }

    private CompletableFuture<TaskOutcome> submit(CleanupTask task) {
        try {
            return CompletableFuture.supplyAsync(() -> run(task), executor)
                    .exceptionally(e -> TaskOutcome.failed(task, unwrap(e)));
        } catch (RuntimeException e) {
            log.error("정리 작업 제출 실패: {}", task, e);
            return CompletableFuture.completedFuture(TaskOutcome.failed(task, e));
        }
    }

    private TaskOutcome run(CleanupTask task) {
        try {
            return execute(task)
                    .map(count -> TaskOutcome.succeeded(task, count))
                    .orElseGet(() -> TaskOutcome.skipped(task));
        } catch (Exception e) {
            log.error("정리 작업 실패: {}", task, e);
            return TaskOutcome.failed(task, e);
        }
    }

    private Optional<TaskCount> execute(CleanupTask task) {
        return switch (task) {
            case PAYMENT_INTENT_EXPIRY -> paymentCleanupPort.expireStaleIntents();
            case STOCK_RESERVATION_EXPIRY -> Optional.of(inventoryCleanupPort.expireStockReservations());
            case WEBHOOK_LOG_ROTATION -> Optional.of(paymentCleanupPort.purgeWebhookLogs());
            case BOOKING_EXPIRY -> Optional.of(bookingCleanupPort.expireOverdueBookings());
            case AUDIT_LOG_ARCHIVAL -> Optional.of(auditCleanupPort.archiveAuditLogs());
        };
    }

    private void logSummary(CycleReport report) {
        log.info("정리 사이클 완료: 성공 {}, 실패 {}, 건너뜀 {}, 처리 {}건, {}ms",
                report.count(TaskStatus.SUCCEEDED), report.count(TaskStatus.FAILED),
                report.count(TaskStatus.SKIPPED), report.totalProcessed(), report.duration().toMillis());
        report.outcomes().stream()
                .filter(TaskOutcome::isFailed)
                .forEach(outcome -> log.warn("정리 작업 실패 결과: {} - {}", outcome.task(), outcome.error()));
    }

    private void recordAudit(CycleReport report) {
        try {
            auditCleanupPort.recordCycle(report);
        } catch (Exception e) {
            log.error("정리 사이클 감사 로그 기록 실패", e);
        }
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}

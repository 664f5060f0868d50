package kr.jemi.zaccess.reconciliation.infrastructure.out.audit;

import kr.jemi.zaccess.audit.api.AuditFacade;
import kr.jemi.zaccess.audit.api.AuditRecord;
import kr.jemi.zaccess.audit.api.AuditSeverity;
import kr.jemi.zaccess.reconciliation.application.port.out.AuditCleanupPort;
import kr.jemi.zaccess.reconciliation.domain.CycleReport;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;
import kr.jemi.zaccess.reconciliation.domain.TaskOutcome;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class AuditCleanupAdapter implements AuditCleanupPort {

    static final String CYCLE_EVENT = "CLEANUP_CYCLE";
    private static final String CATEGORY = "RECONCILIATION";

    private final AuditFacade auditFacade;

    public AuditCleanupAdapter(AuditFacade auditFacade) {
        this.auditFacade = auditFacade;
    }

    @Override
    public TaskCount archiveAuditLogs() {
        return TaskCount.of(auditFacade.archiveExpired());
    }

    @Override
    public void recordCycle(CycleReport report) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("startedAt", report.startedAt().toString());
        metadata.put("durationMillis", report.duration().toMillis());
        for (TaskOutcome outcome : report.outcomes()) {
            Map<String, Object> task = new LinkedHashMap<>();
            task.put("status", outcome.status().name());
            task.put("processed", outcome.processed());
            task.put("found", outcome.found());
            if (outcome.error() != null) {
                task.put("error", outcome.error());
            }
            metadata.put(outcome.task().name(), task);
        }
        AuditSeverity severity = report.hasFailure() ? AuditSeverity.WARN : AuditSeverity.INFO;
        auditFacade.record(new AuditRecord(CYCLE_EVENT, CATEGORY, severity,
                "정리 사이클: 처리 " + report.totalProcessed() + "건", metadata));
    }
}

package kr.jemi.zaccess.reconciliation.application.port.out;

import kr.jemi.zaccess.reconciliation.domain.CycleReport;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;

public interface AuditCleanupPort {

    TaskCount archiveAuditLogs();

    void recordCycle(CycleReport report);
}

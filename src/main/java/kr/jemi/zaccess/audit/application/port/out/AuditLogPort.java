package kr.jemi.zaccess.audit.application.port.out;

import kr.jemi.zaccess.audit.domain.AuditLog;

import java.time.LocalDateTime;

public interface AuditLogPort {

    AuditLog insert(AuditLog auditLog);

    int markArchivedCreatedBefore(LocalDateTime cutoff);
}

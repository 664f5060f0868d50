package kr.jemi.zaccess.audit.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.audit.api.AuditFacade;
import kr.jemi.zaccess.audit.api.AuditRecord;
import kr.jemi.zaccess.audit.application.port.out.AuditLogPort;
import kr.jemi.zaccess.audit.domain.AuditLevel;
import kr.jemi.zaccess.audit.domain.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

@Service
public class AuditService implements AuditFacade {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogPort auditLogPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration retention;

    public AuditService(AuditLogPort auditLogPort,
                        TSID.Factory tsidFactory,
                        Clock clock,
                        @Value("${zaccess.audit.retention}") Duration retention) {
        this.auditLogPort = auditLogPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * 호출자의 트랜잭션이 롤백되어도 기록은 남아야 하므로 별도 트랜잭션으로 저장한다.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditRecord record) {
        AuditLog auditLog = AuditLog.create(tsidFactory.generate().toLong(), record.eventType(),
                record.category(), AuditLevel.valueOf(record.severity().name()),
                record.description(), record.metadata(), LocalDateTime.now(clock));
        auditLogPort.insert(auditLog);
    }

    @Override
    @Transactional
    public int archiveExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        int archived = auditLogPort.markArchivedCreatedBefore(cutoff);
        if (archived > 0) {
            log.info("감사 로그 보관 처리: {}건 (기준 {})", archived, cutoff);
        }
        return archived;
    }
}

package kr.jemi.zaccess.audit.infrastructure.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.jemi.zaccess.audit.application.port.out.AuditLogPort;
import kr.jemi.zaccess.audit.domain.AuditLog;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
public class AuditLogJpaAdapter implements AuditLogPort {

    private final AuditLogJpaRepository repository;
    private final ObjectMapper objectMapper;

    public AuditLogJpaAdapter(AuditLogJpaRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public AuditLog insert(AuditLog auditLog) {
        AuditLogJpaEntity entity = new AuditLogJpaEntity(auditLog.id(), auditLog.eventType(),
                auditLog.category(), auditLog.level(), auditLog.description(),
                toJson(auditLog), auditLog.createdAt(), auditLog.archived());
        repository.save(entity);
        return auditLog;
    }

    @Override
    public int markArchivedCreatedBefore(LocalDateTime cutoff) {
        return repository.markArchivedCreatedBefore(cutoff);
    }

    private String toJson(AuditLog auditLog) {
        try {
            return objectMapper.writeValueAsString(auditLog.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "감사 로그 metadata 직렬화 실패: eventType=" + auditLog.eventType(), e);
        }
    }
}

package kr.jemi.zaccess.audit.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 정리 작업 실행 결과와 이상 징후를 남기는 추가 전용 기록.
 */
public record AuditLog(
        long id,
        @NotBlank String eventType,
        @NotBlank String category,
        @NotNull AuditLevel level,
        String description,
        @NotNull Map<String, Object> metadata,
        @NotNull LocalDateTime createdAt,
        boolean archived
) implements SelfValidating {

    public AuditLog(long id, String eventType, String category, AuditLevel level, String description,
                    Map<String, Object> metadata, LocalDateTime createdAt, boolean archived) {
        this.id = id;
        this.eventType = eventType;
        this.category = category;
        this.level = level;
        this.description = description;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.createdAt = createdAt;
        this.archived = archived;
        validateSelf();
    }

    public static AuditLog create(long id, String eventType, String category, AuditLevel level,
                                  String description, Map<String, Object> metadata, LocalDateTime now) {
        return new AuditLog(id, eventType, category, level, description, metadata, now, false);
    }
}

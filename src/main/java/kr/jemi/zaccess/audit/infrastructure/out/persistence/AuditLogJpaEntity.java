package kr.jemi.zaccess.audit.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.audit.domain.AuditLevel;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_log_created_archived", columnList = "createdAt, archived"),
        @Index(name = "idx_audit_log_event_type", columnList = "eventType")
})
public class AuditLogJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, length = 64)
    private String eventType;

    @Column(nullable = false, length = 64)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AuditLevel level;

    @Column(length = 1000)
    private String description;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private boolean archived;

    protected AuditLogJpaEntity() {}

    AuditLogJpaEntity(Long id, String eventType, String category, AuditLevel level, String description,
                      String metadata, LocalDateTime createdAt, boolean archived) {
        this.id = id;
        this.eventType = eventType;
        this.category = category;
        this.level = level;
        this.description = description;
        this.metadata = metadata;
        this.createdAt = createdAt;
        this.archived = archived;
    }

    public Long getId() { return id; }
    public String getEventType() { return eventType; }
    public String getCategory() { return category; }
    public AuditLevel getLevel() { return level; }
    public String getDescription() { return description; }
    public String getMetadata() { return metadata; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public boolean isArchived() { return archived; }
}

package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.payment.domain.WebhookLog;

import java.time.LocalDateTime;

@Entity
@Table(name = "webhook_logs",
        uniqueConstraints = @UniqueConstraint(name = "uk_webhook_log_webhook_id", columnNames = "webhookId"),
        indexes = @Index(name = "idx_webhook_log_processed_at", columnList = "processedAt"))
public class WebhookLogJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, length = 64)
    private String webhookId;

    @Column(nullable = false)
    private String orderId;

    @Column(nullable = false, length = 32)
    private String transactionStatus;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private LocalDateTime processedAt;

    protected WebhookLogJpaEntity() {}

    public static WebhookLogJpaEntity fromDomain(WebhookLog webhookLog) {
        WebhookLogJpaEntity entity = new WebhookLogJpaEntity();
        entity.id = webhookLog.id();
        entity.webhookId = webhookLog.webhookId();
        entity.orderId = webhookLog.orderId();
        entity.transactionStatus = webhookLog.transactionStatus();
        entity.payload = webhookLog.payload();
        entity.processedAt = webhookLog.processedAt();
        return entity;
    }

    public WebhookLog toDomain() {
        return new WebhookLog(id, webhookId, orderId, transactionStatus, payload, processedAt);
    }

    public LocalDateTime getProcessedAt() { return processedAt; }
}

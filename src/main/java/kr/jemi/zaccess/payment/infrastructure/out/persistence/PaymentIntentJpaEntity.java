package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import kr.jemi.zaccess.payment.domain.PaymentIntentStatus;

import java.time.LocalDateTime;

/**
 * activeLockKey는 PENDING/PROCESSING일 때만 값이 있고 unique라서,
 * 같은 사용자·등급의 살아있는 결제 요청이 동시에 두 개 저장되는 것을 DB가 막는다.
 */
@Entity
@Table(name = "payment_intents",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_payment_intent_order_id", columnNames = "orderId"),
                @UniqueConstraint(name = "uk_payment_intent_idempotency_key", columnNames = "idempotencyKey"),
                @UniqueConstraint(name = "uk_payment_intent_active_lock_key", columnNames = "activeLockKey")
        },
        indexes = @Index(name = "idx_payment_intent_status_expires", columnList = "status, expiresAt"))
public class PaymentIntentJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, length = 32)
    private String orderId;

    @Column(nullable = false, length = 128)
    private String idempotencyKey;

    @Column(nullable = false)
    private String lockKey;

    private String activeLockKey;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private Long accessTierId;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentIntentStatus status;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private String cancelReason;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    protected PaymentIntentJpaEntity() {}

    public static PaymentIntentJpaEntity fromDomain(PaymentIntent intent) {
        PaymentIntentJpaEntity entity = new PaymentIntentJpaEntity();
        entity.id = intent.getId();
        entity.orderId = intent.getOrderId();
        entity.idempotencyKey = intent.getIdempotencyKey();
        entity.lockKey = intent.getLockKey();
        entity.userId = intent.getUserId();
        entity.accessTierId = intent.getAccessTierId();
        entity.quantity = intent.getQuantity();
        entity.expiresAt = intent.getExpiresAt();
        entity.version = intent.getVersion();
        entity.createdAt = intent.getCreatedAt();
        entity.update(intent);
        return entity;
    }

    public PaymentIntent toDomain() {
        return new PaymentIntent(id, orderId, idempotencyKey, lockKey, userId, accessTierId, quantity,
                status, expiresAt, cancelReason, version, createdAt, updatedAt);
    }

    public void update(PaymentIntent intent) {
        this.status = intent.getStatus();
        this.activeLockKey = intent.getActiveLockKey();
        this.cancelReason = intent.getCancelReason();
        this.updatedAt = intent.getUpdatedAt();
    }

    public Long getVersion() { return version; }
    public PaymentIntentStatus getStatus() { return status; }
    public String getActiveLockKey() { return activeLockKey; }
}

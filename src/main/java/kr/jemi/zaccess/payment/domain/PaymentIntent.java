package kr.jemi.zaccess.payment.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.time.LocalDateTime;

/**
 * 한 번의 결제 시도.
 * 같은 사용자·등급 조합(lockKey)에는 살아있는(PENDING/PROCESSING) 결제 요청이 하나만 존재할 수 있다.
 * PAID, CANCELLED는 종료 상태이며 이후의 전이 요청은 무시된다.
 */
public class PaymentIntent implements SelfValidating {

    private static final String LOCK_KEY_PREFIX = "payment_intent_";

    private final long id;
    @NotBlank
    private final String orderId;
    @NotBlank
    private final String idempotencyKey;
    @NotBlank
    private final String lockKey;
    @NotBlank
    private final String userId;
    private final long accessTierId;
    @Min(1)
    private final int quantity;
    @NotNull
    private PaymentIntentStatus status;
    @NotNull
    private final LocalDateTime expiresAt;
    private String cancelReason;
    private final Long version;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public PaymentIntent(long id, String orderId, String idempotencyKey, String lockKey, String userId,
                         long accessTierId, int quantity, PaymentIntentStatus status,
                         LocalDateTime expiresAt, String cancelReason, Long version,
                         LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.orderId = orderId;
        this.idempotencyKey = idempotencyKey;
        this.lockKey = lockKey;
        this.userId = userId;
        this.accessTierId = accessTierId;
        this.quantity = quantity;
        this.status = status;
        this.expiresAt = expiresAt;
        this.cancelReason = cancelReason;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static PaymentIntent create(long id, String orderId, String idempotencyKey, String userId,
                                       long accessTierId, int quantity, LocalDateTime expiresAt,
                                       LocalDateTime now) {
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("만료 시각은 현재 이후여야 합니다: " + expiresAt);
        }
        return new PaymentIntent(id, orderId, idempotencyKey, lockKeyOf(userId, accessTierId), userId,
                accessTierId, quantity, PaymentIntentStatus.PENDING, expiresAt, null, null, now, now);
    }

    public static String lockKeyOf(String userId, long accessTierId) {
        return LOCK_KEY_PREFIX + userId + "_" + accessTierId;
    }

    /** 사용자가 게이트웨이 결제를 시작했다. PENDING에서만 전이한다 */
    public boolean startProcessing(LocalDateTime now) {
        if (status != PaymentIntentStatus.PENDING) {
            return false;
        }
        this.status = PaymentIntentStatus.PROCESSING;
        this.updatedAt = now;
        return true;
    }

    public boolean markPaid(LocalDateTime now) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = PaymentIntentStatus.PAID;
        this.updatedAt = now;
        return true;
    }

    public boolean cancel(String reason, LocalDateTime now) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = PaymentIntentStatus.CANCELLED;
        this.cancelReason = reason;
        this.updatedAt = now;
        return true;
    }

    public boolean isStale(LocalDateTime now) {
        return !status.isTerminal() && expiresAt.isBefore(now);
    }

    public boolean isActive(LocalDateTime now) {
        return !status.isTerminal() && !expiresAt.isBefore(now);
    }

    /**
     * 종료 상태가 되면 null이 되어 같은 lockKey로 새 결제 요청을 만들 수 있다.
     */
    public String getActiveLockKey() {
        return status.isTerminal() ? null : lockKey;
    }

    public long getId() {
        return id;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getLockKey() {
        return lockKey;
    }

    public String getUserId() {
        return userId;
    }

    public long getAccessTierId() {
        return accessTierId;
    }

    public int getQuantity() {
        return quantity;
    }

    public PaymentIntentStatus getStatus() {
        return status;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public Long getVersion() {
        return version;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}

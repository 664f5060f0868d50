package kr.jemi.zaccess.inventory.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.time.LocalDateTime;

/**
 * 결제 화면이 열려 있는 동안 재고를 잡아두는 임시 선점.
 * RESERVED 상태인 동안에만 선점 수량이 tier의 reserved에 반영되어 있다.
 */
public class StockReservation implements SelfValidating {

    private final long id;
    private final long accessTierId;
    @NotBlank
    private final String userId;
    @Min(1)
    private final int quantity;
    @NotNull
    private StockReservationStatus status;
    private final Long paymentIntentId;
    @NotNull
    private final LocalDateTime expiresAt;
    private String releaseReason;
    private final Long version;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public StockReservation(long id, long accessTierId, String userId, int quantity,
                            StockReservationStatus status, Long paymentIntentId,
                            LocalDateTime expiresAt, String releaseReason, Long version,
                            LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.accessTierId = accessTierId;
        this.userId = userId;
        this.quantity = quantity;
        this.status = status;
        this.paymentIntentId = paymentIntentId;
        this.expiresAt = expiresAt;
        this.releaseReason = releaseReason;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static StockReservation reserve(long id, long accessTierId, String userId, int quantity,
                                           Long paymentIntentId, LocalDateTime expiresAt,
                                           LocalDateTime now) {
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("만료 시각은 현재 이후여야 합니다: " + expiresAt);
        }
        return new StockReservation(id, accessTierId, userId, quantity,
                StockReservationStatus.RESERVED, paymentIntentId, expiresAt, null, null, now, now);
    }

    /**
     * @return 이번 호출로 해제되었으면 true. 이미 해제·확정된 선점이면 아무것도 하지 않고 false
     */
    public boolean release(String reason, LocalDateTime now) {
        if (status != StockReservationStatus.RESERVED) {
            return false;
        }
        this.status = StockReservationStatus.RELEASED;
        this.releaseReason = reason;
        this.updatedAt = now;
        return true;
    }

    public boolean commit(LocalDateTime now) {
        if (status != StockReservationStatus.RESERVED) {
            return false;
        }
        this.status = StockReservationStatus.COMMITTED;
        this.updatedAt = now;
        return true;
    }

    public boolean isExpired(LocalDateTime now) {
        return status == StockReservationStatus.RESERVED && expiresAt.isBefore(now);
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }

    public long getId() {
        return id;
    }

    public long getAccessTierId() {
        return accessTierId;
    }

    public String getUserId() {
        return userId;
    }

    public int getQuantity() {
        return quantity;
    }

    public StockReservationStatus getStatus() {
        return status;
    }

    public Long getPaymentIntentId() {
        return paymentIntentId;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public String getReleaseReason() {
        return releaseReason;
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

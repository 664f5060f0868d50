package kr.jemi.zaccess.inventory.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 판매 가능한 티켓 등급. 수량은 항상 {@code sold + reserved + available = total}을 만족한다.
 * <ul>
 *     <li>sold: PENDING 또는 PAID 예매에 배정된 수량</li>
 *     <li>reserved: 결제 화면용 임시 선점(StockReservation)에 묶인 수량</li>
 *     <li>available: 남은 수량</li>
 * </ul>
 */
public class AccessTier implements SelfValidating {

    private final long id;
    private final long eventId;
    @NotBlank
    private final String name;
    @NotNull
    @PositiveOrZero
    private final BigDecimal price;
    @Min(1)
    private final int totalQuantity;
    @Min(0)
    private int soldQuantity;
    @Min(0)
    private int reservedQuantity;
    @Min(0)
    private int availableQuantity;
    private final Long version;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public AccessTier(long id, long eventId, String name, BigDecimal price, int totalQuantity,
                      int soldQuantity, int reservedQuantity, int availableQuantity, Long version,
                      LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.eventId = eventId;
        this.name = name;
        this.price = price;
        this.totalQuantity = totalQuantity;
        this.soldQuantity = soldQuantity;
        this.reservedQuantity = reservedQuantity;
        this.availableQuantity = availableQuantity;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validate();
    }

    public static AccessTier create(long id, long eventId, String name, BigDecimal price,
                                    int totalQuantity, LocalDateTime now) {
        return new AccessTier(id, eventId, name, price, totalQuantity,
                0, 0, totalQuantity, null, now, now);
    }

    private void validate() {
        validateSelf();
        if (soldQuantity + reservedQuantity + availableQuantity != totalQuantity) {
            throw new IllegalArgumentException(String.format(
                    "수량 합계가 총 수량과 다릅니다: sold=%d, reserved=%d, available=%d, total=%d",
                    soldQuantity, reservedQuantity, availableQuantity, totalQuantity));
        }
    }

    /** 예매에 재고를 배정한다. available → sold */
    public void allocate(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        requireAvailable(quantity);
        this.availableQuantity -= quantity;
        this.soldQuantity += quantity;
        this.updatedAt = now;
    }

    /** 만료·취소된 예매의 재고를 되돌린다. sold → available */
    public void deallocate(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        if (soldQuantity < quantity) {
            throw new IllegalStateException(
                    "배정 수량보다 많이 반환할 수 없습니다: sold=" + soldQuantity + ", 요청=" + quantity);
        }
        this.soldQuantity -= quantity;
        this.availableQuantity += quantity;
        this.updatedAt = now;
    }

    /** 임시 선점. available → reserved */
    public void hold(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        requireAvailable(quantity);
        this.availableQuantity -= quantity;
        this.reservedQuantity += quantity;
        this.updatedAt = now;
    }

    /** 임시 선점 해제. reserved → available */
    public void releaseHold(int quantity, LocalDateTime now) {
        requireReserved(quantity);
        this.reservedQuantity -= quantity;
        this.availableQuantity += quantity;
        this.updatedAt = now;
    }

    /** 임시 선점을 판매로 확정. reserved → sold */
    public void commitHold(int quantity, LocalDateTime now) {
        requireReserved(quantity);
        this.reservedQuantity -= quantity;
        this.soldQuantity += quantity;
        this.updatedAt = now;
    }

    public double utilizationRate() {
        return (double) (soldQuantity + reservedQuantity) * 100 / totalQuantity;
    }

    private void requireAvailable(int quantity) {
        if (availableQuantity < quantity) {
            throw new InsufficientStockException(id, quantity, availableQuantity);
        }
    }

    private void requireReserved(int quantity) {
        requirePositive(quantity);
        if (reservedQuantity < quantity) {
            throw new IllegalStateException(
                    "선점 수량보다 많이 처리할 수 없습니다: reserved=" + reservedQuantity + ", 요청=" + quantity);
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
    }

    public long getId() {
        return id;
    }

    public long getEventId() {
        return eventId;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public int getTotalQuantity() {
        return totalQuantity;
    }

    public int getSoldQuantity() {
        return soldQuantity;
    }

    public int getReservedQuantity() {
        return reservedQuantity;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
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

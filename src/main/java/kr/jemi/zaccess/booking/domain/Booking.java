package kr.jemi.zaccess.booking.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import kr.jemi.zaccess.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 한 구매자가 특정 등급 N장을 점유한 예매.
 * PENDING에서 PAID/CANCELLED/EXPIRED 중 하나로 단 한 번만 전이하며, 종료 상태에서의 전이 요청은 무시된다.
 */
public class Booking implements SelfValidating {

    private final long id;
    @NotBlank
    private final String bookingCode;
    @NotBlank
    private final String userId;
    private final long eventId;
    private final long accessTierId;
    @Min(1)
    private final int quantity;
    @NotNull
    @PositiveOrZero
    private final BigDecimal totalAmount;
    @NotNull
    private BookingStatus status;
    @NotNull
    private PaymentStatus paymentStatus;
    @NotNull
    private final LocalDateTime expiresAt;
    private LocalDateTime expiryWarningAt;
    private LocalDateTime paidAt;
    private final Long version;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    private final List<Object> events = new ArrayList<>();

    public Booking(long id, String bookingCode, String userId, long eventId, long accessTierId,
                   int quantity, BigDecimal totalAmount, BookingStatus status,
                   PaymentStatus paymentStatus, LocalDateTime expiresAt,
                   LocalDateTime expiryWarningAt, LocalDateTime paidAt, Long version,
                   LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.bookingCode = bookingCode;
        this.userId = userId;
        this.eventId = eventId;
        this.accessTierId = accessTierId;
        this.quantity = quantity;
        this.totalAmount = totalAmount;
        this.status = status;
        this.paymentStatus = paymentStatus;
        this.expiresAt = expiresAt;
        this.expiryWarningAt = expiryWarningAt;
        this.paidAt = paidAt;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static Booking create(long id, String bookingCode, String userId, StockAllocation allocation,
                                 LocalDateTime expiresAt, LocalDateTime now) {
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("결제 기한은 현재 이후여야 합니다: " + expiresAt);
        }
        return new Booking(id, bookingCode, userId, allocation.eventId(), allocation.accessTierId(),
                allocation.quantity(), allocation.totalAmount(), BookingStatus.PENDING,
                PaymentStatus.PENDING, expiresAt, null, null, null, now, now);
    }

    private void registerEvent(Object event) {
        events.add(event);
    }

    public List<Object> pullEvents() {
        List<Object> result = List.copyOf(events);
        events.clear();
        return result;
    }

    /**
     * 결제 확인. 재고는 이미 sold에 반영되어 있으므로 건드리지 않는다.
     */
    public boolean markPaid(LocalDateTime now) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = BookingStatus.PAID;
        this.paymentStatus = PaymentStatus.PAID;
        this.paidAt = now;
        this.updatedAt = now;
        return true;
    }

    /**
     * 결제 기한이 지났고 결제도 아직 대기 중일 때만 만료된다.
     * @return true이면 호출자가 같은 트랜잭션에서 재고를 반환해야 한다
     */
    public boolean expire(LocalDateTime now) {
        if (!isAwaitingPayment() || !now.isAfter(expiresAt)) {
            return false;
        }
        this.status = BookingStatus.EXPIRED;
        this.paymentStatus = PaymentStatus.EXPIRED;
        this.updatedAt = now;
        registerEvent(new PaymentExpiredEvent(userId, bookingCode, eventContext()));
        return true;
    }

    /**
     * @param paymentOutcome 취소 사유에 따른 결제 상태. 관리자·정리 취소는 EXPIRED, 게이트웨이 실패는 FAILED
     * @return true이면 호출자가 같은 트랜잭션에서 재고를 반환해야 한다
     */
    public boolean cancel(PaymentStatus paymentOutcome, LocalDateTime now) {
        if (paymentOutcome != PaymentStatus.EXPIRED && paymentOutcome != PaymentStatus.FAILED) {
            throw new IllegalArgumentException("취소 시 결제 상태는 EXPIRED 또는 FAILED여야 합니다: " + paymentOutcome);
        }
        if (status.isTerminal()) {
            return false;
        }
        this.status = BookingStatus.CANCELLED;
        this.paymentStatus = paymentOutcome;
        this.updatedAt = now;
        return true;
    }

    /**
     * 결제 기한이 reminderWindow 안으로 들어왔고 아직 알림을 보내지 않았을 때 한 번만 알림 이벤트를 남긴다.
     */
    public boolean remind(LocalDateTime now, Duration reminderWindow) {
        if (!isRemindable(now, reminderWindow)) {
            return false;
        }
        this.expiryWarningAt = now;
        this.updatedAt = now;
        registerEvent(new PaymentReminderEvent(userId, bookingCode, eventContext()));
        return true;
    }

    public boolean isRemindable(LocalDateTime now, Duration reminderWindow) {
        return isAwaitingPayment()
                && expiryWarningAt == null
                && !expiresAt.isBefore(now)
                && !expiresAt.isAfter(now.plus(reminderWindow));
    }

    public boolean isAwaitingPayment() {
        return status == BookingStatus.PENDING && paymentStatus == PaymentStatus.PENDING;
    }

    private EventContext eventContext() {
        return new EventContext(eventId, accessTierId, quantity, totalAmount, expiresAt);
    }

    public long getId() {
        return id;
    }

    public String getBookingCode() {
        return bookingCode;
    }

    public String getUserId() {
        return userId;
    }

    public long getEventId() {
        return eventId;
    }

    public long getAccessTierId() {
        return accessTierId;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public BookingStatus getStatus() {
        return status;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public LocalDateTime getExpiryWarningAt() {
        return expiryWarningAt;
    }

    public LocalDateTime getPaidAt() {
        return paidAt;
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

package kr.jemi.zaccess.booking.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.booking.domain.Booking;
import kr.jemi.zaccess.booking.domain.BookingStatus;
import kr.jemi.zaccess.booking.domain.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_booking_status_expires", columnList = "status, paymentStatus, expiresAt"),
        @Index(name = "idx_booking_created", columnList = "createdAt")
})
public class BookingJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, unique = true, length = 32)
    private String bookingCode;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long accessTierId;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus paymentStatus;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private LocalDateTime expiryWarningAt;

    private LocalDateTime paidAt;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    protected BookingJpaEntity() {}

    public static BookingJpaEntity fromDomain(Booking booking) {
        BookingJpaEntity entity = new BookingJpaEntity();
        entity.id = booking.getId();
        entity.bookingCode = booking.getBookingCode();
        entity.userId = booking.getUserId();
        entity.eventId = booking.getEventId();
        entity.accessTierId = booking.getAccessTierId();
        entity.quantity = booking.getQuantity();
        entity.totalAmount = booking.getTotalAmount();
        entity.expiresAt = booking.getExpiresAt();
        entity.version = booking.getVersion();
        entity.createdAt = booking.getCreatedAt();
        entity.update(booking);
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, bookingCode, userId, eventId, accessTierId, quantity, totalAmount,
                status, paymentStatus, expiresAt, expiryWarningAt, paidAt, version, createdAt, updatedAt);
    }

    public void update(Booking booking) {
        this.status = booking.getStatus();
        this.paymentStatus = booking.getPaymentStatus();
        this.expiryWarningAt = booking.getExpiryWarningAt();
        this.paidAt = booking.getPaidAt();
        this.updatedAt = booking.getUpdatedAt();
    }

    public Long getVersion() { return version; }
    public BookingStatus getStatus() { return status; }
}

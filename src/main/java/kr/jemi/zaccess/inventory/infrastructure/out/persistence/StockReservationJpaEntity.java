package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import kr.jemi.zaccess.inventory.domain.StockReservationStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "stock_reservations", indexes = {
        @Index(name = "idx_stock_reservation_status_expires", columnList = "status, expiresAt"),
        @Index(name = "idx_stock_reservation_tier", columnList = "accessTierId")
})
public class StockReservationJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long accessTierId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StockReservationStatus status;

    private Long paymentIntentId;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private String releaseReason;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    protected StockReservationJpaEntity() {}

    public static StockReservationJpaEntity fromDomain(StockReservation reservation) {
        StockReservationJpaEntity entity = new StockReservationJpaEntity();
        entity.id = reservation.getId();
        entity.accessTierId = reservation.getAccessTierId();
        entity.userId = reservation.getUserId();
        entity.quantity = reservation.getQuantity();
        entity.paymentIntentId = reservation.getPaymentIntentId();
        entity.expiresAt = reservation.getExpiresAt();
        entity.version = reservation.getVersion();
        entity.createdAt = reservation.getCreatedAt();
        entity.update(reservation);
        return entity;
    }

    public StockReservation toDomain() {
        return new StockReservation(id, accessTierId, userId, quantity, status, paymentIntentId,
                expiresAt, releaseReason, version, createdAt, updatedAt);
    }

    public void update(StockReservation reservation) {
        this.status = reservation.getStatus();
        this.releaseReason = reservation.getReleaseReason();
        this.updatedAt = reservation.getUpdatedAt();
    }

    public Long getVersion() { return version; }
    public StockReservationStatus getStatus() { return status; }
}

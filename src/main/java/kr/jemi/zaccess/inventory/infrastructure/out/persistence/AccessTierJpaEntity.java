package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zaccess.inventory.domain.AccessTier;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "access_tiers", indexes = @Index(name = "idx_access_tier_event", columnList = "eventId"))
public class AccessTierJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, updatable = false)
    private int totalQuantity;

    @Column(nullable = false)
    private int soldQuantity;

    @Column(nullable = false)
    private int reservedQuantity;

    @Column(nullable = false)
    private int availableQuantity;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    protected AccessTierJpaEntity() {}

    public static AccessTierJpaEntity fromDomain(AccessTier tier) {
        AccessTierJpaEntity entity = new AccessTierJpaEntity();
        entity.id = tier.getId();
        entity.eventId = tier.getEventId();
        entity.name = tier.getName();
        entity.price = tier.getPrice();
        entity.totalQuantity = tier.getTotalQuantity();
        entity.version = tier.getVersion();
        entity.createdAt = tier.getCreatedAt();
        entity.update(tier);
        return entity;
    }

    public AccessTier toDomain() {
        return new AccessTier(id, eventId, name, price, totalQuantity, soldQuantity,
                reservedQuantity, availableQuantity, version, createdAt, updatedAt);
    }

    public void update(AccessTier tier) {
        this.soldQuantity = tier.getSoldQuantity();
        this.reservedQuantity = tier.getReservedQuantity();
        this.availableQuantity = tier.getAvailableQuantity();
        this.updatedAt = tier.getUpdatedAt();
    }

    public Long getId() { return id; }
    public Long getVersion() { return version; }
}

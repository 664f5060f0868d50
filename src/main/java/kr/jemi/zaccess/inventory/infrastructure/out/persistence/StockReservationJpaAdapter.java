package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import kr.jemi.zaccess.inventory.application.port.out.StockReservationPort;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import kr.jemi.zaccess.inventory.domain.StockReservationStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class StockReservationJpaAdapter implements StockReservationPort {

    private final StockReservationJpaRepository repository;

    public StockReservationJpaAdapter(StockReservationJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public StockReservation insert(StockReservation reservation) {
        return repository.save(StockReservationJpaEntity.fromDomain(reservation)).toDomain();
    }

    @Override
    public StockReservation update(StockReservation reservation) {
        StockReservationJpaEntity entity = repository.findById(reservation.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "재고 선점을 찾을 수 없습니다: id=" + reservation.getId()));
        if (!Objects.equals(entity.getVersion(), reservation.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(
                    StockReservationJpaEntity.class, reservation.getId());
        }
        entity.update(reservation);
        return repository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<StockReservation> findById(long id) {
        return repository.findById(id).map(StockReservationJpaEntity::toDomain);
    }

    @Override
    public List<Long> findExpiredIds(LocalDateTime now, int limit) {
        return repository.findIdsByStatusAndExpiresAtBefore(
                StockReservationStatus.RESERVED, now, PageRequest.of(0, limit));
    }

    @Override
    public long countActiveByAccessTierId(long accessTierId) {
        return repository.countByAccessTierIdAndStatus(accessTierId, StockReservationStatus.RESERVED);
    }
}

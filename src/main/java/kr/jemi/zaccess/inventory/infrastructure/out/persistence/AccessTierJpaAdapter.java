package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import kr.jemi.zaccess.inventory.application.port.out.AccessTierPort;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Component
public class AccessTierJpaAdapter implements AccessTierPort {

    private final AccessTierJpaRepository repository;

    public AccessTierJpaAdapter(AccessTierJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public AccessTier insert(AccessTier accessTier) {
        return repository.save(AccessTierJpaEntity.fromDomain(accessTier)).toDomain();
    }

    @Override
    public AccessTier update(AccessTier accessTier) {
        AccessTierJpaEntity entity = repository.findById(accessTier.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "티켓 등급을 찾을 수 없습니다: id=" + accessTier.getId()));
        if (!Objects.equals(entity.getVersion(), accessTier.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(AccessTierJpaEntity.class, accessTier.getId());
        }
        entity.update(accessTier);
        // 버전 충돌을 커밋 시점이 아니라 여기서 드러내기 위해 즉시 flush
        return repository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<AccessTier> findById(long id) {
        return repository.findById(id).map(AccessTierJpaEntity::toDomain);
    }
}

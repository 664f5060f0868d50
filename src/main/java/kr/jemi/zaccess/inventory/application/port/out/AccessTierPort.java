package kr.jemi.zaccess.inventory.application.port.out;

import kr.jemi.zaccess.inventory.domain.AccessTier;

import java.util.Optional;

public interface AccessTierPort {

    AccessTier insert(AccessTier accessTier);

    /**
     * 버전이 다르면 {@link org.springframework.dao.OptimisticLockingFailureException}을 던진다.
     */
    AccessTier update(AccessTier accessTier);

    Optional<AccessTier> findById(long id);
}

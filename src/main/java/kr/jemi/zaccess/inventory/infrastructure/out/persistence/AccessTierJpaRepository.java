package kr.jemi.zaccess.inventory.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AccessTierJpaRepository extends JpaRepository<AccessTierJpaEntity, Long> {
}

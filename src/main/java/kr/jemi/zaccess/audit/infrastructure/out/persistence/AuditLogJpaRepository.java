package kr.jemi.zaccess.audit.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface AuditLogJpaRepository extends JpaRepository<AuditLogJpaEntity, Long> {

    @Modifying
    @Query("update AuditLogJpaEntity a set a.archived = true "
            + "where a.archived = false and a.createdAt < :cutoff")
    int markArchivedCreatedBefore(@Param("cutoff") LocalDateTime cutoff);

    List<AuditLogJpaEntity> findByEventType(String eventType);
}

package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface WebhookLogJpaRepository extends JpaRepository<WebhookLogJpaEntity, Long> {

    boolean existsByWebhookId(String webhookId);

    @Query("select w.id from WebhookLogJpaEntity w where w.processedAt < :cutoff order by w.processedAt")
    List<Long> findIdsProcessedBefore(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);

    @Modifying
    @Query("delete from WebhookLogJpaEntity w where w.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}

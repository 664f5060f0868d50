package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import kr.jemi.zaccess.payment.application.port.out.WebhookLogPort;
import kr.jemi.zaccess.payment.domain.WebhookLog;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

@Component
public class WebhookLogJpaAdapter implements WebhookLogPort {

    private final WebhookLogJpaRepository repository;

    public WebhookLogJpaAdapter(WebhookLogJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean existsByWebhookId(String webhookId) {
        return repository.existsByWebhookId(webhookId);
    }

    @Override
    public WebhookLog insert(WebhookLog webhookLog) {
        return repository.saveAndFlush(WebhookLogJpaEntity.fromDomain(webhookLog)).toDomain();
    }

    @Override
    public List<Long> findIdsProcessedBefore(LocalDateTime cutoff, int limit) {
        return repository.findIdsProcessedBefore(cutoff, PageRequest.of(0, limit));
    }

    @Override
    public int deleteByIds(List<Long> ids) {
        return repository.deleteByIdIn(ids);
    }
}

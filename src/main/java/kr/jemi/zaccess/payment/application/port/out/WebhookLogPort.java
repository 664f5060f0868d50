package kr.jemi.zaccess.payment.application.port.out;

import kr.jemi.zaccess.payment.domain.WebhookLog;

import java.time.LocalDateTime;
import java.util.List;

public interface WebhookLogPort {

    boolean existsByWebhookId(String webhookId);

    /**
     * 같은 webhookId가 이미 있으면 {@link org.springframework.dao.DataIntegrityViolationException}
     */
    WebhookLog insert(WebhookLog webhookLog);

    List<Long> findIdsProcessedBefore(LocalDateTime cutoff, int limit);

    int deleteByIds(List<Long> ids);
}

package kr.jemi.zaccess.payment.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.common.concurrency.BatchThrottle;
import kr.jemi.zaccess.payment.application.port.in.PurgeWebhookLogsUseCase;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookCommand;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookUseCase;
import kr.jemi.zaccess.payment.application.port.out.WebhookLogPort;
import kr.jemi.zaccess.payment.domain.WebhookLog;
import kr.jemi.zaccess.payment.domain.WebhookOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

@Service
public class WebhookService implements ReceiveWebhookUseCase, PurgeWebhookLogsUseCase {

    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private final WebhookWriter webhookWriter;
    private final WebhookLogPort webhookLogPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration retention;
    private final int purgeBatchSize;
    private final Duration purgeBatchDelay;

    public WebhookService(WebhookWriter webhookWriter,
                          WebhookLogPort webhookLogPort,
                          TSID.Factory tsidFactory,
                          Clock clock,
                          @Value("${zaccess.payment.webhook.retention}") Duration retention,
                          @Value("${zaccess.payment.webhook.purge-batch-size}") int purgeBatchSize,
                          @Value("${zaccess.payment.webhook.purge-batch-delay}") Duration purgeBatchDelay) {
        this.webhookWriter = webhookWriter;
        this.webhookLogPort = webhookLogPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.retention = retention;
        this.purgeBatchSize = purgeBatchSize;
        this.purgeBatchDelay = purgeBatchDelay;
    }

    @Override
    public WebhookOutcome receive(ReceiveWebhookCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        WebhookLog webhookLog = WebhookLog.create(tsidFactory.generate().toLong(), command.orderId(),
                command.transactionStatus(), command.signatureKey(), command.payload(), now);

        if (webhookLogPort.existsByWebhookId(webhookLog.webhookId())) {
            log.info("중복 웹훅 무시: orderId={}, status={}", command.orderId(), command.transactionStatus());
            return WebhookOutcome.duplicated();
        }
        try {
            boolean applied = webhookWriter.recordAndApply(webhookLog, now);
            log.info("웹훅 처리: orderId={}, status={}, applied={}",
                    command.orderId(), command.transactionStatus(), applied);
            return WebhookOutcome.processed(applied);
        } catch (DataIntegrityViolationException e) {
            log.info("동시에 수신된 중복 웹훅 무시: orderId={}, status={}",
                    command.orderId(), command.transactionStatus());
            return WebhookOutcome.duplicated();
        }
    }

    @Override
    public int purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        int purged = 0;
        while (true) {
            int deleted = webhookWriter.deleteBatch(cutoff, purgeBatchSize);
            purged += deleted;
            if (deleted < purgeBatchSize || !BatchThrottle.pause(purgeBatchDelay)) {
                break;
            }
        }
        if (purged > 0) {
            log.info("웹훅 로그 정리: {}건 삭제 (기준 {})", purged, cutoff);
        }
        return purged;
    }
}

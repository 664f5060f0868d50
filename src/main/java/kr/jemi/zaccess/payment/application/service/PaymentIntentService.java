package kr.jemi.zaccess.payment.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.common.concurrency.OptimisticRetry;
import kr.jemi.zaccess.common.concurrency.SingleFlight;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentCommand;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentUseCase;
import kr.jemi.zaccess.payment.application.port.in.ExpireStaleIntentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.GetPaymentIntentUseCase;
import kr.jemi.zaccess.payment.application.port.out.PaymentIntentPort;
import kr.jemi.zaccess.payment.domain.IntentExpiryResult;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class PaymentIntentService
        implements CreatePaymentIntentUseCase, GetPaymentIntentUseCase, ExpireStaleIntentsUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentIntentService.class);

    static final String EXPIRY_JOB = "expireStaleIntents";
    private static final String ORDER_ID_PREFIX = "PI";

    private final PaymentIntentWriter writer;
    private final PaymentIntentPort paymentIntentPort;
    private final SingleFlight singleFlight;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration intentTtl;
    private final int batchSize;
    private final int maxBatchesPerRun;
    private final int maxAttempts;

    public PaymentIntentService(PaymentIntentWriter writer,
                                PaymentIntentPort paymentIntentPort,
                                SingleFlight singleFlight,
                                TSID.Factory tsidFactory,
                                Clock clock,
                                @Value("${zaccess.payment.intent-ttl}") Duration intentTtl,
                                @Value("${zaccess.payment.batch-size}") int batchSize,
                                @Value("${zaccess.payment.max-batches-per-run}") int maxBatchesPerRun,
                                @Value("${zaccess.payment.retry.max-attempts}") int maxAttempts) {
        this.writer = writer;
        this.paymentIntentPort = paymentIntentPort;
        this.singleFlight = singleFlight;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.intentTtl = intentTtl;
        this.batchSize = batchSize;
        this.maxBatchesPerRun = maxBatchesPerRun;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public PaymentIntent create(CreatePaymentIntentCommand command) {
        Optional<PaymentIntent> replay = findReplay(command);
        if (replay.isPresent()) {
            log.debug("idempotencyKey 재요청, 기존 결제 요청 반환: orderId={}", replay.get().getOrderId());
            return replay.get();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        TSID tsid = tsidFactory.generate();
        PaymentIntent intent = PaymentIntent.create(tsid.toLong(), ORDER_ID_PREFIX + tsid,
                command.idempotencyKey(), command.userId(), command.accessTierId(), command.quantity(),
                now.plus(intentTtl), now);

        try {
            PaymentIntent saved = OptimisticRetry.execute("createPaymentIntent", maxAttempts,
                    () -> writer.create(intent, now));
            log.info("결제 요청 생성: orderId={}, lockKey={}, expiresAt={}",
                    saved.getOrderId(), saved.getLockKey(), saved.getExpiresAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 같은 idempotencyKey 또는 lockKey로 동시에 들어온 요청이 먼저 저장됐다
            return findReplay(command)
                    .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_INTENT_LOCKED, e));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentIntent getByOrderId(String orderId) {
        return paymentIntentPort.findByOrderId(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_INTENT_NOT_FOUND, orderId));
    }

    @Override
    public Optional<IntentExpiryResult> expireStaleIntents() {
        return singleFlight.tryRun(EXPIRY_JOB, this::cancelStaleIntents);
    }

    private IntentExpiryResult cancelStaleIntents() {
        int cancelled = 0;
        int found = 0;
        for (int batch = 0; batch < maxBatchesPerRun; batch++) {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Long> staleIds = paymentIntentPort.findStaleIds(now, batchSize);
            found += staleIds.size();

            int cancelledInBatch = 0;
            for (Long id : staleIds) {
                try {
                    if (OptimisticRetry.execute("expirePaymentIntent", maxAttempts,
                            () -> writer.cancelIfStale(id, now))) {
                        cancelledInBatch++;
                    }
                } catch (Exception e) {
                    log.error("만료 결제 요청 취소 실패: intentId={}", id, e);
                }
            }
            cancelled += cancelledInBatch;

            if (staleIds.size() < batchSize || cancelledInBatch == 0 || Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        if (found > 0) {
            log.info("만료 결제 요청 정리: 취소 {}건 / 대상 {}건", cancelled, found);
        }
        return new IntentExpiryResult(cancelled, found);
    }

    private Optional<PaymentIntent> findReplay(CreatePaymentIntentCommand command) {
        Optional<PaymentIntent> existing = paymentIntentPort.findByIdempotencyKey(command.idempotencyKey());
        if (existing.isPresent() && !existing.get().getUserId().equals(command.userId())) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "다른 사용자의 idempotencyKey입니다");
        }
        return existing;
    }
}

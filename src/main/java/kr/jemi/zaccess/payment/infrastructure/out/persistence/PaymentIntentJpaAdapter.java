package kr.jemi.zaccess.payment.infrastructure.out.persistence;

import kr.jemi.zaccess.payment.application.port.out.PaymentIntentPort;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import kr.jemi.zaccess.payment.domain.PaymentIntentStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class PaymentIntentJpaAdapter implements PaymentIntentPort {

    private static final EnumSet<PaymentIntentStatus> LIVE_STATUSES =
            EnumSet.of(PaymentIntentStatus.PENDING, PaymentIntentStatus.PROCESSING);

    private final PaymentIntentJpaRepository repository;

    public PaymentIntentJpaAdapter(PaymentIntentJpaRepository repository) {
        this.repository = repository;
    }

    /**
     * unique 제약 위반이 호출 지점에서 드러나도록 즉시 flush한다.
     */
    @Override
    public PaymentIntent insert(PaymentIntent intent) {
        return repository.saveAndFlush(PaymentIntentJpaEntity.fromDomain(intent)).toDomain();
    }

    /**
     * 취소로 activeLockKey를 비우는 UPDATE가 같은 트랜잭션의 INSERT보다 먼저 나가야 하므로 즉시 flush한다.
     */
    @Override
    public PaymentIntent update(PaymentIntent intent) {
        PaymentIntentJpaEntity entity = repository.findById(intent.getId())
                .orElseThrow(() -> new IllegalStateException("결제 요청을 찾을 수 없습니다: id=" + intent.getId()));
        if (!Objects.equals(entity.getVersion(), intent.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(PaymentIntentJpaEntity.class, intent.getId());
        }
        entity.update(intent);
        return repository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<PaymentIntent> findById(long id) {
        return repository.findById(id).map(PaymentIntentJpaEntity::toDomain);
    }

    @Override
    public Optional<PaymentIntent> findByOrderId(String orderId) {
        return repository.findByOrderId(orderId).map(PaymentIntentJpaEntity::toDomain);
    }

    @Override
    public Optional<PaymentIntent> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(PaymentIntentJpaEntity::toDomain);
    }

    @Override
    public Optional<PaymentIntent> findActiveByLockKey(String lockKey) {
        return repository.findByActiveLockKey(lockKey).map(PaymentIntentJpaEntity::toDomain);
    }

    @Override
    public List<Long> findStaleIds(LocalDateTime now, int limit) {
        return repository.findIdsByStatusInAndExpiresAtBefore(LIVE_STATUSES, now, PageRequest.of(0, limit));
    }
}

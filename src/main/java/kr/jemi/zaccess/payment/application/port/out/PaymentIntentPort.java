package kr.jemi.zaccess.payment.application.port.out;

import kr.jemi.zaccess.payment.domain.PaymentIntent;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PaymentIntentPort {

    PaymentIntent insert(PaymentIntent intent);

    PaymentIntent update(PaymentIntent intent);

    Optional<PaymentIntent> findById(long id);

    Optional<PaymentIntent> findByOrderId(String orderId);

    Optional<PaymentIntent> findByIdempotencyKey(String idempotencyKey);

    /** PENDING 또는 PROCESSING 상태로 lockKey를 점유 중인 결제 요청 */
    Optional<PaymentIntent> findActiveByLockKey(String lockKey);

    /** PENDING/PROCESSING이면서 expiresAt이 now 이전인 결제 요청 ID. 오래된 순 */
    List<Long> findStaleIds(LocalDateTime now, int limit);
}

package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.payment.application.port.out.PaymentIntentPort;
import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class PaymentIntentWriter {

    static final String REASON_EXPIRED = "expired";

    private final PaymentIntentPort paymentIntentPort;

    public PaymentIntentWriter(PaymentIntentPort paymentIntentPort) {
        this.paymentIntentPort = paymentIntentPort;
    }

    /**
     * 같은 lockKey의 살아있는 결제 요청이 있으면 거절한다.
     * 만료됐지만 아직 정리되지 않은 요청은 먼저 취소해 lockKey를 비운 뒤 새 요청을 저장한다.
     */
    @Transactional
    public PaymentIntent create(PaymentIntent intent, LocalDateTime now) {
        Optional<PaymentIntent> holder = paymentIntentPort.findActiveByLockKey(intent.getLockKey());
        if (holder.isPresent()) {
            PaymentIntent existing = holder.get();
            if (existing.isActive(now)) {
                throw new BusinessException(ErrorCode.PAYMENT_INTENT_LOCKED, existing.getOrderId());
            }
            existing.cancel(REASON_EXPIRED, now);
            paymentIntentPort.update(existing);
        }
        return paymentIntentPort.insert(intent);
    }

    @Transactional
    public boolean cancelIfStale(long intentId, LocalDateTime now) {
        PaymentIntent intent = paymentIntentPort.findById(intentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_INTENT_NOT_FOUND, "id=" + intentId));
        if (!intent.isStale(now) || !intent.cancel(REASON_EXPIRED, now)) {
            return false;
        }
        paymentIntentPort.update(intent);
        return true;
    }

    /**
     * 게이트웨이 상태를 결제 요청에 반영한다. 종료 상태의 요청은 바뀌지 않는다.
     * @return 상태가 바뀌었으면 true
     */
    @Transactional
    public boolean applyGatewayStatus(PaymentIntent intent, GatewayTransactionStatus status, LocalDateTime now) {
        boolean changed;
        if (status.isSuccess()) {
            changed = intent.markPaid(now);
        } else if (status.isFailure()) {
            changed = intent.cancel("gateway_" + status.name().toLowerCase(), now);
        } else if (status.isPending()) {
            changed = intent.startProcessing(now);
        } else {
            changed = false;
        }
        if (changed) {
            paymentIntentPort.update(intent);
        }
        return changed;
    }
}

package kr.jemi.zaccess.integration;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentCommand;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentUseCase;
import kr.jemi.zaccess.payment.application.port.in.ExpireStaleIntentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.GetPaymentIntentUseCase;
import kr.jemi.zaccess.payment.domain.IntentExpiryResult;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import kr.jemi.zaccess.payment.domain.PaymentIntentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class PaymentIntentIntegrationTest extends IntegrationTestBase {

    @Autowired
    CreatePaymentIntentUseCase createPaymentIntentUseCase;

    @Autowired
    GetPaymentIntentUseCase getPaymentIntentUseCase;

    @Autowired
    ExpireStaleIntentsUseCase expireStaleIntentsUseCase;

    private PaymentIntent create(String userId, long tierId, String idempotencyKey) {
        return createPaymentIntentUseCase.create(new CreatePaymentIntentCommand(userId, tierId, 1, idempotencyKey));
    }

    @Test
    @DisplayName("만료된 결제 요청은 한 번만 CANCELLED로 정리되고, 바로 다시 돌리면 대상이 없다")
    void staleIntentCancelledOnce() {
        PaymentIntent intent = create("user-1", 7L, "idem-1");
        clock.advance(Duration.ofMinutes(30).plusSeconds(1));

        IntentExpiryResult first = expireStaleIntentsUseCase.expireStaleIntents().orElseThrow();
        IntentExpiryResult second = expireStaleIntentsUseCase.expireStaleIntents().orElseThrow();

        assertThat(first).isEqualTo(new IntentExpiryResult(1, 1));
        assertThat(second).isEqualTo(new IntentExpiryResult(0, 0));

        PaymentIntent cancelled = getPaymentIntentUseCase.getByOrderId(intent.getOrderId());
        assertThat(cancelled.getStatus()).isEqualTo(PaymentIntentStatus.CANCELLED);
        assertThat(cancelled.getCancelReason()).isEqualTo("expired");
    }

    @Test
    @DisplayName("같은 사용자·등급에 살아있는 결제 요청이 있으면 새 요청은 PAYMENT_INTENT_LOCKED")
    void secondLiveIntentIsLocked() {
        create("user-1", 7L, "idem-1");

        assertThatThrownBy(() -> create("user-1", 7L, "idem-2"))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PAYMENT_INTENT_LOCKED));
        assertThat(paymentIntentJpaRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 등급이나 다른 사용자는 잠금과 무관하다")
    void lockIsPerUserAndTier() {
        create("user-1", 7L, "idem-1");

        assertThatCode(() -> create("user-1", 8L, "idem-2")).doesNotThrowAnyException();
        assertThatCode(() -> create("user-2", 7L, "idem-3")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("만료됐지만 아직 정리되지 않은 점유자는 새 요청이 밀어내고 취소한다")
    void staleHolderIsTakenOver() {
        PaymentIntent old = create("user-1", 7L, "idem-1");
        clock.advance(Duration.ofMinutes(31));

        PaymentIntent fresh = create("user-1", 7L, "idem-2");

        assertThat(fresh.getStatus()).isEqualTo(PaymentIntentStatus.PENDING);
        assertThat(getPaymentIntentUseCase.getByOrderId(old.getOrderId()).getStatus())
                .isEqualTo(PaymentIntentStatus.CANCELLED);
    }

    @Test
    @DisplayName("같은 idempotencyKey로 다시 요청하면 같은 결제 요청을 돌려준다")
    void idempotentReplay() {
        PaymentIntent first = create("user-1", 7L, "idem-1");
        PaymentIntent replay = create("user-1", 7L, "idem-1");

        assertThat(replay.getOrderId()).isEqualTo(first.getOrderId());
        assertThat(paymentIntentJpaRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("없는 주문번호는 PAYMENT_INTENT_NOT_FOUND")
    void unknownOrderId() {
        assertThatThrownBy(() -> getPaymentIntentUseCase.getByOrderId("PI-NONE"))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PAYMENT_INTENT_NOT_FOUND));
    }
}

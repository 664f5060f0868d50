package kr.jemi.zaccess.payment.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class PaymentIntentTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 5, 1, 12, 0);

    private static PaymentIntent pending() {
        return PaymentIntent.create(1L, "PI0001", "idem-1", "user-1", 7L, 2, NOW.plusMinutes(15), NOW);
    }

    @Test
    @DisplayName("lockKey는 사용자와 등급으로 만들어진다")
    void lockKeyFormat() {
        assertThat(PaymentIntent.lockKeyOf("user-1", 7L)).isEqualTo("payment_intent_user-1_7");
        assertThat(pending().getLockKey()).isEqualTo("payment_intent_user-1_7");
    }

    @Nested
    @DisplayName("상태 전이")
    class Transitions {

        @Test
        @DisplayName("PENDING에서만 PROCESSING으로 간다")
        void startProcessingOnlyFromPending() {
            PaymentIntent intent = pending();

            assertThat(intent.startProcessing(NOW)).isTrue();
            assertThat(intent.startProcessing(NOW)).isFalse();
            assertThat(intent.getStatus()).isEqualTo(PaymentIntentStatus.PROCESSING);
        }

        @Test
        @DisplayName("결제 완료 후에는 취소되지 않는다")
        void paidIsTerminal() {
            PaymentIntent intent = pending();
            intent.markPaid(NOW);

            assertThat(intent.cancel("expired", NOW)).isFalse();
            assertThat(intent.getStatus()).isEqualTo(PaymentIntentStatus.PAID);
            assertThat(intent.getCancelReason()).isNull();
        }

        @Test
        @DisplayName("취소하면 사유가 남는다")
        void cancelKeepsReason() {
            PaymentIntent intent = pending();

            assertThat(intent.cancel("gateway_DENY", NOW)).isTrue();
            assertThat(intent.getCancelReason()).isEqualTo("gateway_DENY");
        }
    }

    @Nested
    @DisplayName("activeLockKey")
    class ActiveLockKey {

        @Test
        @DisplayName("PENDING/PROCESSING 동안에만 잠금 키를 가진다")
        void heldWhileLive() {
            PaymentIntent intent = pending();
            assertThat(intent.getActiveLockKey()).isEqualTo(intent.getLockKey());

            intent.startProcessing(NOW);
            assertThat(intent.getActiveLockKey()).isEqualTo(intent.getLockKey());

            intent.cancel("expired", NOW);
            assertThat(intent.getActiveLockKey()).isNull();
        }
    }

    @Nested
    @DisplayName("isStale() / isActive()")
    class Staleness {

        @Test
        @DisplayName("만료 시각이 지난 살아있는 요청은 stale이다")
        void staleAfterExpiry() {
            PaymentIntent intent = pending();

            assertThat(intent.isStale(NOW.plusMinutes(14))).isFalse();
            assertThat(intent.isActive(NOW.plusMinutes(14))).isTrue();
            assertThat(intent.isStale(NOW.plusMinutes(16))).isTrue();
            assertThat(intent.isActive(NOW.plusMinutes(16))).isFalse();
        }

        @Test
        @DisplayName("종료된 요청은 만료 시각이 지나도 stale이 아니다")
        void terminalIsNeverStale() {
            PaymentIntent intent = pending();
            intent.markPaid(NOW);

            assertThat(intent.isStale(NOW.plusHours(1))).isFalse();
        }
    }
}

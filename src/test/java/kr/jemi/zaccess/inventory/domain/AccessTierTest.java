package kr.jemi.zaccess.inventory.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class AccessTierTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 5, 1, 12, 0);

    private static AccessTier tier(int total) {
        return AccessTier.create(1L, 10L, "VIP", new BigDecimal("150000"), total, NOW);
    }

    private static void assertSumInvariant(AccessTier tier) {
        assertThat(tier.getSoldQuantity() + tier.getReservedQuantity() + tier.getAvailableQuantity())
                .as("sold + reserved + available = total")
                .isEqualTo(tier.getTotalQuantity());
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("전체 수량이 모두 available로 시작한다")
        void startsFullyAvailable() {
            AccessTier tier = tier(100);

            assertThat(tier.getAvailableQuantity()).isEqualTo(100);
            assertThat(tier.getSoldQuantity()).isZero();
            assertThat(tier.getReservedQuantity()).isZero();
            assertThat(tier.getVersion()).isNull();
        }

        @Test
        @DisplayName("수량 합계가 total과 다르면 생성할 수 없다")
        void rejectsBrokenSum() {
            assertThatThrownBy(() -> new AccessTier(1L, 10L, "VIP", BigDecimal.TEN, 10,
                    3, 0, 3, 0L, NOW, NOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("수량 합계");
        }

        @Test
        @DisplayName("음수 가격은 검증에 실패한다")
        void rejectsNegativePrice() {
            assertThatThrownBy(() -> AccessTier.create(1L, 10L, "VIP", new BigDecimal("-1"), 10, NOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("price");
        }
    }

    @Nested
    @DisplayName("allocate() / deallocate()")
    class Allocation {

        @Test
        @DisplayName("배정하면 available이 줄고 sold가 는다")
        void allocateMovesAvailableToSold() {
            AccessTier tier = tier(10);

            tier.allocate(3, NOW.plusMinutes(1));

            assertThat(tier.getAvailableQuantity()).isEqualTo(7);
            assertThat(tier.getSoldQuantity()).isEqualTo(3);
            assertThat(tier.getUpdatedAt()).isEqualTo(NOW.plusMinutes(1));
            assertSumInvariant(tier);
        }

        @Test
        @DisplayName("남은 수량보다 많이 요청하면 InsufficientStockException, 상태는 그대로")
        void rejectsOversell() {
            AccessTier tier = tier(2);

            assertThatThrownBy(() -> tier.allocate(3, NOW))
                    .isInstanceOfSatisfying(InsufficientStockException.class, e -> {
                        assertThat(e.getRequested()).isEqualTo(3);
                        assertThat(e.getAvailable()).isEqualTo(2);
                    });
            assertThat(tier.getAvailableQuantity()).isEqualTo(2);
            assertThat(tier.getSoldQuantity()).isZero();
        }

        @Test
        @DisplayName("마지막 한 장까지 배정할 수 있다")
        void allocatesLastUnit() {
            AccessTier tier = tier(1);

            tier.allocate(1, NOW);

            assertThat(tier.getAvailableQuantity()).isZero();
            assertThat(tier.utilizationRate()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("반환하면 sold가 줄고 available이 는다")
        void deallocateReturnsStock() {
            AccessTier tier = tier(10);
            tier.allocate(4, NOW);

            tier.deallocate(4, NOW);

            assertThat(tier.getAvailableQuantity()).isEqualTo(10);
            assertThat(tier.getSoldQuantity()).isZero();
        }

        @Test
        @DisplayName("배정된 수량보다 많이 반환할 수 없다")
        void rejectsOverReturn() {
            AccessTier tier = tier(10);
            tier.allocate(1, NOW);

            assertThatThrownBy(() -> tier.deallocate(2, NOW))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("수량이 0 이하면 거절한다")
        void rejectsNonPositive() {
            AccessTier tier = tier(10);

            assertThatThrownBy(() -> tier.allocate(0, NOW))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("hold() / releaseHold() / commitHold()")
    class Hold {

        @Test
        @DisplayName("선점하면 available에서 reserved로 옮겨진다")
        void holdMovesToReserved() {
            AccessTier tier = tier(10);

            tier.hold(2, NOW);

            assertThat(tier.getReservedQuantity()).isEqualTo(2);
            assertThat(tier.getAvailableQuantity()).isEqualTo(8);
            assertSumInvariant(tier);
        }

        @Test
        @DisplayName("선점 해제는 reserved를 available로 되돌린다")
        void releaseHoldReturnsToAvailable() {
            AccessTier tier = tier(10);
            tier.hold(2, NOW);

            tier.releaseHold(2, NOW);

            assertThat(tier.getReservedQuantity()).isZero();
            assertThat(tier.getAvailableQuantity()).isEqualTo(10);
        }

        @Test
        @DisplayName("선점 확정은 reserved를 sold로 옮긴다")
        void commitHoldMovesToSold() {
            AccessTier tier = tier(10);
            tier.hold(2, NOW);

            tier.commitHold(2, NOW);

            assertThat(tier.getReservedQuantity()).isZero();
            assertThat(tier.getSoldQuantity()).isEqualTo(2);
            assertThat(tier.getAvailableQuantity()).isEqualTo(8);
            assertSumInvariant(tier);
        }

        @Test
        @DisplayName("선점한 것보다 많이 해제할 수 없다")
        void rejectsOverRelease() {
            AccessTier tier = tier(10);
            tier.hold(1, NOW);

            assertThatThrownBy(() -> tier.releaseHold(2, NOW))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("선점도 남은 수량을 넘을 수 없다")
        void holdCannotOversell() {
            AccessTier tier = tier(3);
            tier.allocate(2, NOW);

            assertThatThrownBy(() -> tier.hold(2, NOW))
                    .isInstanceOf(InsufficientStockException.class);
        }
    }
}

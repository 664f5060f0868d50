package kr.jemi.zaccess.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockCommand;
import kr.jemi.zaccess.inventory.application.port.out.StockReservationPort;
import kr.jemi.zaccess.inventory.domain.ReservationExpiryResult;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class StockReservationServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-01T03:00:00Z"), ZONE);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Duration TTL = Duration.ofMinutes(10);
    private static final int BATCH_SIZE = 2;
    private static final int MAX_ATTEMPTS = 3;

    @Mock
    private StockReservationWriter writer;

    @Mock
    private StockReservationPort stockReservationPort;

    private final TSID.Factory tsidFactory = TSID.Factory.newInstance256(0);

    private StockReservationService service;

    @BeforeEach
    void setUp() {
        service = new StockReservationService(writer, stockReservationPort, tsidFactory, CLOCK,
                TTL, BATCH_SIZE, Duration.ZERO, 5, MAX_ATTEMPTS);
    }

    @Nested
    @DisplayName("reserve()")
    class Reserve {

        @Test
        @DisplayName("기본 TTL로 만료 시각을 정해 선점한다")
        void usesDefaultTtl() {
            // given
            given(writer.hold(any(StockReservation.class))).willAnswer(inv -> inv.getArgument(0));

            // when
            StockReservation result = service.reserve(new ReserveStockCommand(7L, "user-1", 2));

            // then
            assertThat(result.getExpiresAt()).isEqualTo(NOW.plus(TTL));
            assertThat(result.getQuantity()).isEqualTo(2);
            assertThat(result.getAccessTierId()).isEqualTo(7L);
        }

        @Test
        @DisplayName("요청에 TTL이 있으면 그 값을 쓴다")
        void usesRequestedTtl() {
            // given
            given(writer.hold(any(StockReservation.class))).willAnswer(inv -> inv.getArgument(0));

            // when
            StockReservation result = service.reserve(
                    new ReserveStockCommand(7L, "user-1", 1, null, Duration.ofMinutes(3)));

            // then
            assertThat(result.getExpiresAt()).isEqualTo(NOW.plusMinutes(3));
        }

        @Test
        @DisplayName("낙관적 락 충돌이 나면 다시 시도한다")
        void retriesOnConflict() {
            // given
            given(writer.hold(any(StockReservation.class)))
                    .willThrow(new OptimisticLockingFailureException("conflict"))
                    .willAnswer(inv -> inv.getArgument(0));

            // when
            service.reserve(new ReserveStockCommand(7L, "user-1", 1));

            // then
            then(writer).should(times(2)).hold(any(StockReservation.class));
        }

        @Test
        @DisplayName("재시도 한도를 넘으면 CONCURRENT_MODIFICATION")
        void failsAfterMaxAttempts() {
            // given
            given(writer.hold(any(StockReservation.class)))
                    .willThrow(new OptimisticLockingFailureException("conflict"));

            // when & then
            assertThatThrownBy(() -> service.reserve(new ReserveStockCommand(7L, "user-1", 1)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CONCURRENT_MODIFICATION));
            then(writer).should(times(MAX_ATTEMPTS)).hold(any(StockReservation.class));
        }
    }

    @Nested
    @DisplayName("release()")
    class Release {

        @Test
        @DisplayName("이미 처리된 선점이면 false")
        void alreadyReleased() {
            // given
            given(writer.release(eq(1L), eq("cancelled"), any(LocalDateTime.class))).willReturn(false);

            // when & then
            assertThat(service.release(1L, "cancelled")).isFalse();
        }
    }

    @Nested
    @DisplayName("expireReservations()")
    class ExpireReservations {

        @Test
        @DisplayName("짧은 배치가 나올 때까지 만료 선점을 해제한다")
        void drainsUntilShortBatch() {
            // given
            given(stockReservationPort.findExpiredIds(NOW, BATCH_SIZE))
                    .willReturn(List.of(1L, 2L))
                    .willReturn(List.of(3L));
            given(writer.releaseIfExpired(anyLong(), eq(NOW))).willReturn(true);

            // when
            ReservationExpiryResult result = service.expireReservations();

            // then
            assertThat(result).isEqualTo(new ReservationExpiryResult(3, 3));
            then(stockReservationPort).should(times(2)).findExpiredIds(NOW, BATCH_SIZE);
        }

        @Test
        @DisplayName("한 건이 실패해도 나머지는 계속 처리한다")
        void continuesAfterItemFailure() {
            // given
            given(stockReservationPort.findExpiredIds(NOW, BATCH_SIZE))
                    .willReturn(List.of(1L, 2L))
                    .willReturn(List.of());
            given(writer.releaseIfExpired(1L, NOW)).willThrow(new IllegalStateException("boom"));
            given(writer.releaseIfExpired(2L, NOW)).willReturn(true);

            // when
            ReservationExpiryResult result = service.expireReservations();

            // then
            assertThat(result.released()).isEqualTo(1);
            assertThat(result.found()).isEqualTo(2);
        }

        @Test
        @DisplayName("한 배치에서 아무것도 해제하지 못하면 멈춘다")
        void stopsWhenNothingReleased() {
            // given
            given(stockReservationPort.findExpiredIds(NOW, BATCH_SIZE)).willReturn(List.of(1L, 2L));
            given(writer.releaseIfExpired(anyLong(), eq(NOW))).willReturn(false);

            // when
            ReservationExpiryResult result = service.expireReservations();

            // then
            assertThat(result).isEqualTo(new ReservationExpiryResult(0, 2));
            then(stockReservationPort).should(times(1)).findExpiredIds(NOW, BATCH_SIZE);
        }
    }
}

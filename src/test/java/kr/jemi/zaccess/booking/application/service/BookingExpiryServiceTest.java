package kr.jemi.zaccess.booking.application.service;

import kr.jemi.zaccess.booking.application.port.out.BookingPort;
import kr.jemi.zaccess.booking.domain.SweepResult;
import kr.jemi.zaccess.common.concurrency.LocalSingleFlight;
import kr.jemi.zaccess.common.concurrency.SingleFlight;
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
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class BookingExpiryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Duration REMINDER_WINDOW = Duration.ofMinutes(10);
    private static final int BATCH_SIZE = 3;
    private static final int MAX_BATCHES = 2;

    @Mock
    private BookingWriter bookingWriter;

    @Mock
    private BookingPort bookingPort;

    private final SingleFlight singleFlight = new LocalSingleFlight();

    private BookingExpiryService service;

    @BeforeEach
    void setUp() {
        service = new BookingExpiryService(bookingWriter, bookingPort, singleFlight, CLOCK,
                REMINDER_WINDOW, BATCH_SIZE, Duration.ZERO, MAX_BATCHES, 3);
    }

    @Nested
    @DisplayName("expireOverdue()")
    class ExpireOverdue {

        @Test
        @DisplayName("대상이 없으면 아무것도 하지 않는다")
        void noTargets() {
            // given
            given(bookingPort.findExpiredPendingIds(NOW, BATCH_SIZE)).willReturn(List.of());

            // when
            SweepResult result = service.expireOverdue();

            // then
            assertThat(result).isEqualTo(SweepResult.empty());
            then(bookingWriter).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("이미 결제된 예매는 만료 건수에 들어가지 않는다")
        void countsOnlyActualTransitions() {
            // given
            given(bookingPort.findExpiredPendingIds(NOW, BATCH_SIZE)).willReturn(List.of(1L, 2L));
            given(bookingWriter.expire(1L, NOW)).willReturn(true);
            given(bookingWriter.expire(2L, NOW)).willReturn(false);

            // when
            SweepResult result = service.expireOverdue();

            // then
            assertThat(result).isEqualTo(new SweepResult(1, 2));
        }

        @Test
        @DisplayName("최대 배치 수에 도달하면 멈춘다")
        void stopsAtMaxBatches() {
            // given
            given(bookingPort.findExpiredPendingIds(NOW, BATCH_SIZE)).willReturn(List.of(1L, 2L, 3L));
            given(bookingWriter.expire(anyLong(), eq(NOW))).willReturn(true);

            // when
            SweepResult result = service.expireOverdue();

            // then
            assertThat(result).isEqualTo(new SweepResult(6, 6));
            then(bookingPort).should(times(MAX_BATCHES)).findExpiredPendingIds(NOW, BATCH_SIZE);
        }

        @Test
        @DisplayName("충돌이 나면 그 건만 다시 시도한다")
        void retriesConflictingItem() {
            // given
            given(bookingPort.findExpiredPendingIds(NOW, BATCH_SIZE)).willReturn(List.of(1L));
            given(bookingWriter.expire(1L, NOW))
                    .willThrow(new OptimisticLockingFailureException("conflict"))
                    .willReturn(true);

            // when
            SweepResult result = service.expireOverdue();

            // then
            assertThat(result.processed()).isEqualTo(1);
            then(bookingWriter).should(times(2)).expire(1L, NOW);
        }
    }

    @Nested
    @DisplayName("sendReminders()")
    class SendReminders {

        @Test
        @DisplayName("알림 구간 안의 예매에 알림을 보낸다")
        void remindsWithinWindow() {
            // given
            given(bookingPort.findRemindableIds(NOW, NOW.plus(REMINDER_WINDOW), BATCH_SIZE))
                    .willReturn(List.of(5L));
            given(bookingWriter.remind(5L, NOW, REMINDER_WINDOW)).willReturn(true);

            // when
            Optional<SweepResult> result = service.sendReminders();

            // then
            assertThat(result).contains(new SweepResult(1, 1));
        }

        @Test
        @DisplayName("이미 실행 중이면 건너뛴다")
        void skipsWhenRunning() {
            // when
            Optional<Optional<SweepResult>> nested = singleFlight.tryRun(
                    BookingExpiryService.REMINDER_JOB, () -> service.sendReminders());

            // then
            assertThat(nested).contains(Optional.empty());
            then(bookingPort).shouldHaveNoInteractions();
        }
    }
}

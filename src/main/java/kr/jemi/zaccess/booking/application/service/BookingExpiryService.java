package kr.jemi.zaccess.booking.application.service;

import kr.jemi.zaccess.booking.application.port.in.ExpireBookingsUseCase;
import kr.jemi.zaccess.booking.application.port.in.SendPaymentRemindersUseCase;
import kr.jemi.zaccess.booking.application.port.out.BookingPort;
import kr.jemi.zaccess.booking.domain.SweepResult;
import kr.jemi.zaccess.common.concurrency.BatchThrottle;
import kr.jemi.zaccess.common.concurrency.OptimisticRetry;
import kr.jemi.zaccess.common.concurrency.SingleFlight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 결제 기한 기반의 두 배치: 만료 처리와 기한 임박 알림.
 * 한 번에 batchSize건씩 가져와 건마다 별도 트랜잭션으로 처리한다.
 */
@Service
public class BookingExpiryService implements ExpireBookingsUseCase, SendPaymentRemindersUseCase {

    private static final Logger log = LoggerFactory.getLogger(BookingExpiryService.class);

    static final String REMINDER_JOB = "sendPaymentReminders";

    private final BookingWriter bookingWriter;
    private final BookingPort bookingPort;
    private final SingleFlight singleFlight;
    private final Clock clock;
    private final Duration reminderWindow;
    private final int batchSize;
    private final Duration batchDelay;
    private final int maxBatchesPerRun;
    private final int maxAttempts;

    public BookingExpiryService(BookingWriter bookingWriter,
                                BookingPort bookingPort,
                                SingleFlight singleFlight,
                                Clock clock,
                                @Value("${zaccess.booking.reminder-window}") Duration reminderWindow,
                                @Value("${zaccess.booking.batch-size}") int batchSize,
                                @Value("${zaccess.booking.batch-delay}") Duration batchDelay,
                                @Value("${zaccess.booking.max-batches-per-run}") int maxBatchesPerRun,
                                @Value("${zaccess.booking.retry.max-attempts}") int maxAttempts) {
        this.bookingWriter = bookingWriter;
        this.bookingPort = bookingPort;
        this.singleFlight = singleFlight;
        this.clock = clock;
        this.reminderWindow = reminderWindow;
        this.batchSize = batchSize;
        this.batchDelay = batchDelay;
        this.maxBatchesPerRun = maxBatchesPerRun;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public SweepResult expireOverdue() {
        SweepResult result = drain(
                now -> bookingPort.findExpiredPendingIds(now, batchSize),
                (id, now) -> OptimisticRetry.execute("expireBooking", maxAttempts,
                        () -> bookingWriter.expire(id, now)),
                "예매 만료");
        if (result.found() > 0) {
            log.info("결제 기한 만료 처리: 만료 {}건 / 대상 {}건", result.processed(), result.found());
        }
        return result;
    }

    @Override
    public Optional<SweepResult> sendReminders() {
        return singleFlight.tryRun(REMINDER_JOB, () -> {
            SweepResult result = drain(
                    now -> bookingPort.findRemindableIds(now, now.plus(reminderWindow), batchSize),
                    (id, now) -> OptimisticRetry.execute("remindBooking", maxAttempts,
                            () -> bookingWriter.remind(id, now, reminderWindow)),
                    "결제 알림");
            if (result.found() > 0) {
                log.info("결제 기한 임박 알림: 발송 {}건 / 대상 {}건", result.processed(), result.found());
            }
            return result;
        });
    }

    /**
     * 짧은 배치가 나오거나, 한 건도 처리하지 못했거나, 최대 배치 수에 도달하면 멈춘다.
     * 실패한 건은 다음 실행에서 다시 조회된다.
     */
    private SweepResult drain(Function<LocalDateTime, List<Long>> fetch,
                              ItemHandler handler, String jobName) {
        int processed = 0;
        int found = 0;
        for (int batch = 0; batch < maxBatchesPerRun; batch++) {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Long> ids = fetch.apply(now);
            found += ids.size();

            int processedInBatch = (int) ids.stream()
                    .filter(handleSafely(handler, now, jobName))
                    .count();
            processed += processedInBatch;

            if (ids.size() < batchSize || processedInBatch == 0 || !BatchThrottle.pause(batchDelay)) {
                break;
            }
        }
        return new SweepResult(processed, found);
    }

    private static Predicate<Long> handleSafely(ItemHandler handler, LocalDateTime now, String jobName) {
        return id -> {
            try {
                return handler.handle(id, now);
            } catch (Exception e) {
                log.error("{} 처리 실패: bookingId={}", jobName, id, e);
                return false;
            }
        };
    }

    @FunctionalInterface
    private interface ItemHandler {
        boolean handle(long bookingId, LocalDateTime now);
    }
}

package kr.jemi.zaccess.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.common.concurrency.BatchThrottle;
import kr.jemi.zaccess.common.concurrency.OptimisticRetry;
import kr.jemi.zaccess.inventory.application.port.in.ExpireStockReservationsUseCase;
import kr.jemi.zaccess.inventory.application.port.in.ReleaseStockUseCase;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockCommand;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockUseCase;
import kr.jemi.zaccess.inventory.application.port.out.StockReservationPort;
import kr.jemi.zaccess.inventory.domain.ReservationExpiryResult;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class StockReservationService
        implements ReserveStockUseCase, ReleaseStockUseCase, ExpireStockReservationsUseCase {

    private static final Logger log = LoggerFactory.getLogger(StockReservationService.class);

    private final StockReservationWriter writer;
    private final StockReservationPort stockReservationPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration reservationTtl;
    private final int batchSize;
    private final Duration batchDelay;
    private final int maxBatchesPerRun;
    private final int maxAttempts;

    public StockReservationService(StockReservationWriter writer,
                                   StockReservationPort stockReservationPort,
                                   TSID.Factory tsidFactory,
                                   Clock clock,
                                   @Value("${zaccess.inventory.reservation-ttl}") Duration reservationTtl,
                                   @Value("${zaccess.inventory.batch-size}") int batchSize,
                                   @Value("${zaccess.inventory.batch-delay}") Duration batchDelay,
                                   @Value("${zaccess.inventory.max-batches-per-run}") int maxBatchesPerRun,
                                   @Value("${zaccess.inventory.retry.max-attempts}") int maxAttempts) {
        this.writer = writer;
        this.stockReservationPort = stockReservationPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.reservationTtl = reservationTtl;
        this.batchSize = batchSize;
        this.batchDelay = batchDelay;
        this.maxBatchesPerRun = maxBatchesPerRun;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public StockReservation reserve(ReserveStockCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        Duration ttl = command.ttl() != null ? command.ttl() : reservationTtl;
        StockReservation reservation = StockReservation.reserve(
                tsidFactory.generate().toLong(), command.accessTierId(), command.userId(),
                command.quantity(), command.paymentIntentId(), now.plus(ttl), now);

        StockReservation saved = OptimisticRetry.execute("reserveStock", maxAttempts,
                () -> writer.hold(reservation));
        log.info("재고 선점: reservationId={}, tierId={}, quantity={}, expiresAt={}",
                saved.getId(), saved.getAccessTierId(), saved.getQuantity(), saved.getExpiresAt());
        return saved;
    }

    @Override
    public boolean release(long stockReservationId, String reason) {
        boolean released = OptimisticRetry.execute("releaseStock", maxAttempts,
                () -> writer.release(stockReservationId, reason, LocalDateTime.now(clock)));
        if (released) {
            log.info("재고 선점 해제: reservationId={}, reason={}", stockReservationId, reason);
        } else {
            log.debug("이미 처리된 재고 선점, 해제 생략: reservationId={}", stockReservationId);
        }
        return released;
    }

    @Override
    public ReservationExpiryResult expireReservations() {
        int released = 0;
        int found = 0;
        for (int batch = 0; batch < maxBatchesPerRun; batch++) {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Long> expiredIds = stockReservationPort.findExpiredIds(now, batchSize);
            found += expiredIds.size();

            int releasedInBatch = 0;
            for (Long id : expiredIds) {
                try {
                    if (OptimisticRetry.execute("expireStockReservation", maxAttempts,
                            () -> writer.releaseIfExpired(id, now))) {
                        releasedInBatch++;
                    }
                } catch (Exception e) {
                    log.error("만료 재고 선점 해제 실패: reservationId={}", id, e);
                }
            }
            released += releasedInBatch;

            if (expiredIds.size() < batchSize || releasedInBatch == 0 || !BatchThrottle.pause(batchDelay)) {
                break;
            }
        }
        if (found > 0) {
            log.info("만료 재고 선점 정리: 해제 {}건 / 대상 {}건", released, found);
        }
        return new ReservationExpiryResult(released, found);
    }
}

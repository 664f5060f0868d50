package kr.jemi.zaccess.integration;

import kr.jemi.zaccess.booking.application.port.in.CheckoutCommand;
import kr.jemi.zaccess.booking.application.port.in.CheckoutUseCase;
import kr.jemi.zaccess.inventory.application.port.in.GetStockStatusUseCase;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockCommand;
import kr.jemi.zaccess.inventory.application.port.in.ReserveStockUseCase;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.inventory.domain.InsufficientStockException;
import kr.jemi.zaccess.inventory.domain.StockStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StockConcurrencyIntegrationTest extends IntegrationTestBase {

    @Autowired
    ReserveStockUseCase reserveStockUseCase;

    @Autowired
    CheckoutUseCase checkoutUseCase;

    @Autowired
    GetStockStatusUseCase getStockStatusUseCase;

    @Test
    @DisplayName("동시 선점 경쟁: 재고 10개에 20개 스레드, 정확히 10개만 성공하고 초과 판매가 없다")
    void concurrentReservationsNeverOversell() throws InterruptedException {
        AccessTier tier = createTier(10);
        int threadCount = 20;

        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();
        AtomicInteger otherFailureCount = new AtomicInteger();

        runConcurrently(threadCount, i -> {
            try {
                reserveStockUseCase.reserve(new ReserveStockCommand(tier.getId(), "user-" + i, 1));
                successCount.incrementAndGet();
            } catch (InsufficientStockException e) {
                insufficientCount.incrementAndGet();
            } catch (RuntimeException e) {
                otherFailureCount.incrementAndGet();
            }
        });

        assertThat(successCount).as("성공 수").hasValue(10);
        assertThat(insufficientCount).as("재고 부족 수").hasValue(10);
        assertThat(otherFailureCount).as("그 밖의 실패").hasValue(0);

        StockStatus status = getStockStatusUseCase.getStockStatus(tier.getId());
        assertThat(status.availableQuantity()).isZero();
        assertThat(status.reservedQuantity()).isEqualTo(10);
        assertThat(status.activeReservationCount()).isEqualTo(10);
        assertThat(status.soldQuantity() + status.reservedQuantity() + status.availableQuantity())
                .isEqualTo(status.totalQuantity());
    }

    @Test
    @DisplayName("동시 예매 경쟁: 재고 5개에 수량 2씩 8개 스레드, 성공 2건과 재고 1개가 남는다")
    void concurrentCheckoutsKeepSumInvariant() throws InterruptedException {
        AccessTier tier = createTier(5);
        int threadCount = 8;

        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();

        runConcurrently(threadCount, i -> {
            try {
                checkoutUseCase.checkout(new CheckoutCommand("user-" + i, tier.getId(), 2));
                successCount.incrementAndGet();
            } catch (InsufficientStockException e) {
                insufficientCount.incrementAndGet();
            }
        });

        assertThat(successCount).hasValue(2);
        assertThat(insufficientCount).hasValue(threadCount - 2);

        StockStatus status = getStockStatusUseCase.getStockStatus(tier.getId());
        assertThat(status.soldQuantity()).isEqualTo(4);
        assertThat(status.availableQuantity()).isEqualTo(1);
        assertThat(bookingJpaRepository.count()).isEqualTo(2);
    }

    private static void runConcurrently(int threadCount, IndexedTask task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch readyLatch = new CountDownLatch(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);

        for (int i = 0; i < threadCount; i++) {
            int index = i;
            executor.submit(() -> {
                readyLatch.countDown();
                try {
                    startLatch.await();
                    task.run(index);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        readyLatch.await();
        startLatch.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    }

    @FunctionalInterface
    private interface IndexedTask {
        void run(int index);
    }
}

package kr.jemi.zaccess.common.concurrency;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * 낙관적 락 충돌 시 트랜잭션 전체를 다시 실행한다.
 * action은 매 시도마다 새 트랜잭션을 열어야 한다. 이미 트랜잭션 안에서 호출되면
 * 충돌한 트랜잭션은 어차피 롤백되므로 재시도 없이 한 번만 실행한다.
 */
public final class OptimisticRetry {

    private static final Logger log = LoggerFactory.getLogger(OptimisticRetry.class);

    private static final long MAX_BACKOFF_MILLIS = 50;

    private OptimisticRetry() {}

    public static <T> T execute(String operation, int maxAttempts, Supplier<T> action) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다: " + maxAttempts);
        }
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return action.get();
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.warn("동시 수정 충돌 재시도 한도 초과: {} ({}회)", operation, attempt);
                    throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION, e);
                }
                log.debug("동시 수정 충돌, 재시도: {} ({}회차)", operation, attempt);
                backoff(attempt, e);
            }
        }
    }

    private static void backoff(int attempt, ConcurrencyFailureException cause) {
        long bound = Math.min(MAX_BACKOFF_MILLIS, 2L * attempt) + 1;
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(1, bound + 1));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION, cause);
        }
    }
}

package kr.jemi.zaccess.common.concurrency;

import java.time.Duration;

public final class BatchThrottle {

    private BatchThrottle() {}

    /**
     * 배치 사이에 잠깐 쉬어 DB 부하를 분산한다.
     * @return 인터럽트되면 false. 호출자는 루프를 멈춰야 한다.
     */
    public static boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

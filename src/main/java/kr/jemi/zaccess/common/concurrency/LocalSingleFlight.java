package kr.jemi.zaccess.common.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 프로세스 내부 플래그 기반 구현. 인스턴스 간 배타는 스케줄러의 ShedLock이 담당한다.
 */
@Component
public class LocalSingleFlight implements SingleFlight {

    private static final Logger log = LoggerFactory.getLogger(LocalSingleFlight.class);

    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> tryRun(String name, Supplier<T> action) {
        AtomicBoolean flag = running.computeIfAbsent(name, key -> new AtomicBoolean(false));
        if (!flag.compareAndSet(false, true)) {
            log.info("이전 실행이 끝나지 않아 건너뜀: {}", name);
            return Optional.empty();
        }
        try {
            return Optional.of(action.get());
        } finally {
            flag.set(false);
        }
    }
}

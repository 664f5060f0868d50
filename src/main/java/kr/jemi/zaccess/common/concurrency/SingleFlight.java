package kr.jemi.zaccess.common.concurrency;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 같은 이름의 작업이 동시에 두 번 실행되지 않도록 막는다.
 * 이미 실행 중이면 대기하지 않고 즉시 거절한다.
 */
public interface SingleFlight {

    /**
     * @return 실행 결과. 같은 이름의 작업이 이미 실행 중이면 {@link Optional#empty()}
     */
    <T> Optional<T> tryRun(String name, Supplier<T> action);
}

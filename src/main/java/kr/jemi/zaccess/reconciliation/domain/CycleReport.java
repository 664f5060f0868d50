package kr.jemi.zaccess.reconciliation.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 한 번의 정리 사이클 결과. 작업마다 정확히 하나의 결과를 갖는다.
 */
public record CycleReport(LocalDateTime startedAt, List<TaskOutcome> outcomes, Duration duration) {

    public CycleReport {
        outcomes = List.copyOf(outcomes);
    }

    public Optional<TaskOutcome> outcomeOf(CleanupTask task) {
        return outcomes.stream()
                .filter(outcome -> outcome.task() == task)
                .findFirst();
    }

    public long count(TaskStatus status) {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == status)
                .count();
    }

    public boolean hasFailure() {
        return outcomes.stream().anyMatch(TaskOutcome::isFailed);
    }

    public int totalProcessed() {
        return outcomes.stream().mapToInt(TaskOutcome::processed).sum();
    }
}

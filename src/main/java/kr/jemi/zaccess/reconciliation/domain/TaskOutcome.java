package kr.jemi.zaccess.reconciliation.domain;

public record TaskOutcome(CleanupTask task, TaskStatus status, int processed, int found, String error) {

    public static TaskOutcome succeeded(CleanupTask task, TaskCount count) {
        return new TaskOutcome(task, TaskStatus.SUCCEEDED, count.processed(), count.found(), null);
    }

    public static TaskOutcome failed(CleanupTask task, Throwable cause) {
        String error = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new TaskOutcome(task, TaskStatus.FAILED, 0, 0, error);
    }

    public static TaskOutcome skipped(CleanupTask task) {
        return new TaskOutcome(task, TaskStatus.SKIPPED, 0, 0, null);
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }
}

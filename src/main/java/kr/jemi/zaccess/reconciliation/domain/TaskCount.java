package kr.jemi.zaccess.reconciliation.domain;

public record TaskCount(int processed, int found) {

    public static TaskCount of(int processed) {
        return new TaskCount(processed, processed);
    }
}

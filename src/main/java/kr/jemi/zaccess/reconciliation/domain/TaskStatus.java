package kr.jemi.zaccess.reconciliation.domain;

public enum TaskStatus {
    SUCCEEDED,
    FAILED,
    /** 이전 실행이 아직 끝나지 않아 이번 사이클에서는 건너뜀 */
    SKIPPED
}

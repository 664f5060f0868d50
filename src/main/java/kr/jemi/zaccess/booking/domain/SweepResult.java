package kr.jemi.zaccess.booking.domain;

/**
 * @param processed 이번 실행에서 실제로 상태가 바뀐 건수
 * @param found 조회된 대상 건수
 */
public record SweepResult(int processed, int found) {

    public static SweepResult empty() {
        return new SweepResult(0, 0);
    }
}

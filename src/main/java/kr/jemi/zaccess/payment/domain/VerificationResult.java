package kr.jemi.zaccess.payment.domain;

/**
 * @param verified 결제 완료로 확인되어 예매에 반영된 건수
 * @param failed   게이트웨이가 실패를 확정해 예매를 취소한 건수
 * @param errors   조회 중 오류가 난 건수
 * @param total    조회 대상 건수
 */
public record VerificationResult(int verified, int failed, int errors, int total) {
}

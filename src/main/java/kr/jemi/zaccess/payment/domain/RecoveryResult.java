package kr.jemi.zaccess.payment.domain;

/**
 * @param recovered       만료 처리 전에 찾아 PAID로 확정한 건수
 * @param paidAfterExpiry 게이트웨이는 결제 완료인데 이미 EXPIRED로 만료된 건수. 자동으로 되돌리지 않는다
 * @param checked         확인한 예매 수
 */
public record RecoveryResult(int recovered, int paidAfterExpiry, int checked) {

    public boolean needsAttention() {
        return recovered > 0 || paidAfterExpiry > 0;
    }
}

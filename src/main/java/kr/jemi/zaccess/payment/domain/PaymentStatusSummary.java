package kr.jemi.zaccess.payment.domain;

public record PaymentStatusSummary(long pending, long paid, long failed, long expired) {

    public long total() {
        return pending + paid + failed + expired;
    }
}

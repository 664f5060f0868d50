package kr.jemi.zaccess.booking.api;

public record PaymentStatusCounts(long pending, long paid, long failed, long expired) {

    public long total() {
        return pending + paid + failed + expired;
    }
}

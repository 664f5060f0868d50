package kr.jemi.zaccess.booking.domain;

public enum BookingStatus {
    PENDING,
    PAID,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

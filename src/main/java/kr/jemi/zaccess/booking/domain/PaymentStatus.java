package kr.jemi.zaccess.booking.domain;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    EXPIRED
}

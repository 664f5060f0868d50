package kr.jemi.zaccess.booking.domain;

public record PaymentExpiredEvent(String userId, String bookingCode, EventContext eventContext) {
}

package kr.jemi.zaccess.booking.domain;

public record PaymentReminderEvent(String userId, String bookingCode, EventContext eventContext) {
}

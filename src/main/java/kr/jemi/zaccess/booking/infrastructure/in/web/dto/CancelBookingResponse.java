package kr.jemi.zaccess.booking.infrastructure.in.web.dto;

public record CancelBookingResponse(String bookingCode, boolean cancelled) {
}

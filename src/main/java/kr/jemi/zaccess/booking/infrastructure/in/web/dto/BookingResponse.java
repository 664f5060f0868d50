package kr.jemi.zaccess.booking.infrastructure.in.web.dto;

import kr.jemi.zaccess.booking.domain.Booking;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BookingResponse(String bookingCode, long accessTierId, int quantity, BigDecimal totalAmount,
                              String status, String paymentStatus, LocalDateTime expiresAt,
                              LocalDateTime paidAt) {

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getBookingCode(),
                booking.getAccessTierId(),
                booking.getQuantity(),
                booking.getTotalAmount(),
                booking.getStatus().name(),
                booking.getPaymentStatus().name(),
                booking.getExpiresAt(),
                booking.getPaidAt()
        );
    }
}

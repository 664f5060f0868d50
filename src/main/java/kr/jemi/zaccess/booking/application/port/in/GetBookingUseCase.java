package kr.jemi.zaccess.booking.application.port.in;

import kr.jemi.zaccess.booking.domain.Booking;

public interface GetBookingUseCase {

    Booking getBooking(String bookingCode);
}

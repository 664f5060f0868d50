package kr.jemi.zaccess.booking.application.port.in;

public interface CancelBookingUseCase {

    boolean cancel(String bookingCode);
}

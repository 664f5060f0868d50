package kr.jemi.zaccess.booking.application.port.in;

public interface ConfirmBookingPaymentUseCase {

    boolean confirmPayment(String bookingCode);
}

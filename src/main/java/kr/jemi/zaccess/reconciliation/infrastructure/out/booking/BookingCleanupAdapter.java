package kr.jemi.zaccess.reconciliation.infrastructure.out.booking;

import kr.jemi.zaccess.booking.api.BookingFacade;
import kr.jemi.zaccess.booking.api.BookingSweep;
import kr.jemi.zaccess.reconciliation.application.port.out.BookingCleanupPort;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;
import org.springframework.stereotype.Component;

@Component
public class BookingCleanupAdapter implements BookingCleanupPort {

    private final BookingFacade bookingFacade;

    public BookingCleanupAdapter(BookingFacade bookingFacade) {
        this.bookingFacade = bookingFacade;
    }

    @Override
    public TaskCount expireOverdueBookings() {
        BookingSweep sweep = bookingFacade.expireOverdue();
        return new TaskCount(sweep.expired(), sweep.found());
    }
}

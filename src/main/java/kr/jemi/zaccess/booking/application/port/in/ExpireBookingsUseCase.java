package kr.jemi.zaccess.booking.application.port.in;

import kr.jemi.zaccess.booking.domain.SweepResult;

public interface ExpireBookingsUseCase {

    SweepResult expireOverdue();
}

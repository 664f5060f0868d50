package kr.jemi.zaccess.booking.application.port.in;

import kr.jemi.zaccess.booking.domain.SweepResult;

import java.util.Optional;

public interface SendPaymentRemindersUseCase {

    /**
     * @return 이전 실행이 아직 진행 중이면 empty
     */
    Optional<SweepResult> sendReminders();
}

package kr.jemi.zaccess.booking.api;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public interface BookingFacade {

    boolean exists(String bookingCode);

    /** 결제 대기 중이며 기한이 남은 예매. 최신순 */
    List<PendingPayment> findAwaitingPayment(int limit);

    /**
     * 기한이 lookback 이내에 지난 미결제 예매. 아직 만료 처리 전인 것과 이미 EXPIRED가 된 것을 함께 돌려준다.
     * 오래된 순
     */
    List<PendingPayment> findOverdueUnpaid(Duration lookback, int limit);

    boolean confirmPayment(String bookingCode);

    boolean isPaid(String bookingCode);

    /** 게이트웨이가 결제 실패를 확정한 경우. 예매를 취소하고 재고를 반환한다 */
    boolean failPayment(String bookingCode);

    PaymentStatusCounts countPaymentStatuses(LocalDateTime from, LocalDateTime to);

    BookingSweep expireOverdue();
}

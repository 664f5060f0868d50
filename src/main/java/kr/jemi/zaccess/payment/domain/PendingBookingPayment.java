package kr.jemi.zaccess.payment.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 확인이 필요한 예매. 예매 코드가 게이트웨이의 order_id로 쓰인다.
 * expired가 true면 결제 확인 없이 이미 만료 처리된 예매다.
 */
public record PendingBookingPayment(String bookingCode, String userId, BigDecimal totalAmount,
                                    LocalDateTime expiresAt, LocalDateTime createdAt, boolean expired) {
}

package kr.jemi.zaccess.booking.api;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * @param expired 이미 EXPIRED로 만료 처리된 예매면 true
 */
public record PendingPayment(String bookingCode, String userId, BigDecimal totalAmount,
                             LocalDateTime expiresAt, LocalDateTime createdAt, boolean expired) {
}

package kr.jemi.zaccess.booking.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record EventContext(long eventId, long accessTierId, int quantity, BigDecimal totalAmount,
                           LocalDateTime expiresAt) {
}

package kr.jemi.zaccess.payment.infrastructure.in.web.dto;

import kr.jemi.zaccess.payment.domain.PaymentIntent;

import java.time.LocalDateTime;

public record PaymentIntentResponse(String orderId, long accessTierId, int quantity, String status,
                                    LocalDateTime expiresAt) {

    public static PaymentIntentResponse from(PaymentIntent intent) {
        return new PaymentIntentResponse(
                intent.getOrderId(),
                intent.getAccessTierId(),
                intent.getQuantity(),
                intent.getStatus().name(),
                intent.getExpiresAt()
        );
    }
}

package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.PaymentIntent;

public interface GetPaymentIntentUseCase {

    PaymentIntent getByOrderId(String orderId);
}

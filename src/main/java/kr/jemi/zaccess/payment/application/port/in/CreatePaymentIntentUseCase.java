package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.PaymentIntent;

public interface CreatePaymentIntentUseCase {

    /**
     * 같은 idempotencyKey로 이미 만들어진 결제 요청이 있으면 그것을 돌려준다.
     * 같은 사용자·등급에 살아있는 결제 요청이 있으면 PAYMENT_INTENT_LOCKED.
     */
    PaymentIntent create(CreatePaymentIntentCommand command);
}

package kr.jemi.zaccess.payment.application.port.out;

import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;

public interface PaymentGatewayPort {

    /**
     * 게이트웨이에 주문의 현재 결제 상태를 묻는다.
     * 게이트웨이가 주문을 모르면 {@link GatewayTransactionStatus#UNKNOWN}.
     * 통신 실패는 BusinessException(PAYMENT_GATEWAY_ERROR)로 던진다.
     */
    GatewayTransactionStatus checkStatus(String orderId);
}

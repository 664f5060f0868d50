package kr.jemi.zaccess.payment.infrastructure.out.gateway;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.payment.application.port.out.PaymentGatewayPort;
import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class PaymentGatewayRestAdapter implements PaymentGatewayPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayRestAdapter.class);

    private static final String NOT_FOUND_CODE = "404";

    private final RestClient restClient;

    public PaymentGatewayRestAdapter(@Qualifier("paymentGatewayRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * 게이트웨이는 없는 주문에 대해 HTTP 404 또는 본문의 status_code "404"로 응답한다. 둘 다 UNKNOWN.
     */
    @Override
    public GatewayTransactionStatus checkStatus(String orderId) {
        try {
            GatewayStatusResponse response = restClient.get()
                    .uri("/v2/{orderId}/status", orderId)
                    .retrieve()
                    .body(GatewayStatusResponse.class);
            if (response == null || NOT_FOUND_CODE.equals(response.statusCode())) {
                return GatewayTransactionStatus.UNKNOWN;
            }
            return GatewayTransactionStatus.from(response.transactionStatus());
        } catch (HttpClientErrorException.NotFound e) {
            return GatewayTransactionStatus.UNKNOWN;
        } catch (RestClientException e) {
            log.warn("결제 게이트웨이 상태 조회 실패: orderId={}, {}", orderId, e.getMessage());
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, e);
        }
    }
}

package kr.jemi.zaccess.payment.infrastructure.out.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
record GatewayStatusResponse(
        @JsonProperty("status_code") String statusCode,
        @JsonProperty("order_id") String orderId,
        @JsonProperty("transaction_status") String transactionStatus
) {
}

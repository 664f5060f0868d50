package kr.jemi.zaccess.payment.infrastructure.in.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentWebhookRequest(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("transaction_status") String transactionStatus,
        @JsonProperty("signature_key") String signatureKey
) {
}

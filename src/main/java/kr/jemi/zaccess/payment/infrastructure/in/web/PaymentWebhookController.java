package kr.jemi.zaccess.payment.infrastructure.in.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookCommand;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookUseCase;
import kr.jemi.zaccess.payment.domain.WebhookOutcome;
import kr.jemi.zaccess.payment.infrastructure.in.web.dto.PaymentWebhookRequest;
import kr.jemi.zaccess.payment.infrastructure.in.web.dto.WebhookResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "PaymentWebhook", description = "결제 게이트웨이 웹훅 수신")
@RestController
public class PaymentWebhookController {

    private final ReceiveWebhookUseCase receiveWebhookUseCase;
    private final ObjectMapper objectMapper;

    public PaymentWebhookController(ReceiveWebhookUseCase receiveWebhookUseCase, ObjectMapper objectMapper) {
        this.receiveWebhookUseCase = receiveWebhookUseCase;
        this.objectMapper = objectMapper;
    }

    /**
     * 원문을 그대로 웹훅 로그에 남기기 위해 본문을 문자열로 받는다.
     * 중복 웹훅도 200으로 응답해야 게이트웨이가 재전송을 멈춘다.
     */
    @Operation(summary = "결제 웹훅 수신", description = "이미 처리한 웹훅은 무시하고 200을 반환합니다.")
    @PostMapping(value = "/api/payments/webhook", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookResponse> receive(@RequestBody String body) {
        PaymentWebhookRequest request = parse(body);
        WebhookOutcome outcome = receiveWebhookUseCase.receive(new ReceiveWebhookCommand(
                request.orderId(), request.transactionStatus(), request.signatureKey(), body));
        return ResponseEntity.ok(WebhookResponse.of(request.orderId(), outcome));
    }

    private PaymentWebhookRequest parse(String body) {
        try {
            return objectMapper.readValue(body, PaymentWebhookRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("웹훅 본문을 해석할 수 없습니다", e);
        }
    }
}

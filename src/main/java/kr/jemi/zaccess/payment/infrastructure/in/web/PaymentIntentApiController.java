package kr.jemi.zaccess.payment.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentCommand;
import kr.jemi.zaccess.payment.application.port.in.CreatePaymentIntentUseCase;
import kr.jemi.zaccess.payment.application.port.in.GetPaymentIntentUseCase;
import kr.jemi.zaccess.payment.domain.PaymentIntent;
import kr.jemi.zaccess.payment.infrastructure.in.web.dto.CreatePaymentIntentRequest;
import kr.jemi.zaccess.payment.infrastructure.in.web.dto.PaymentIntentResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "PaymentIntent", description = "결제 요청 생성·조회")
@RestController
public class PaymentIntentApiController {

    private final CreatePaymentIntentUseCase createPaymentIntentUseCase;
    private final GetPaymentIntentUseCase getPaymentIntentUseCase;

    public PaymentIntentApiController(CreatePaymentIntentUseCase createPaymentIntentUseCase,
                                      GetPaymentIntentUseCase getPaymentIntentUseCase) {
        this.createPaymentIntentUseCase = createPaymentIntentUseCase;
        this.getPaymentIntentUseCase = getPaymentIntentUseCase;
    }

    @Operation(summary = "결제 요청 생성",
            description = "같은 사용자·등급에 진행 중인 결제 요청이 있으면 409를 반환합니다. 같은 idempotencyKey 재요청은 기존 결제 요청을 돌려줍니다.")
    @PostMapping("/api/payment-intents")
    public ResponseEntity<PaymentIntentResponse> create(
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CreatePaymentIntentRequest request) {
        PaymentIntent intent = createPaymentIntentUseCase.create(new CreatePaymentIntentCommand(
                userId, request.accessTierId(), request.quantity(), request.idempotencyKey()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentIntentResponse.from(intent));
    }

    @Operation(summary = "결제 요청 조회")
    @GetMapping("/api/payment-intents/{orderId}")
    public ResponseEntity<PaymentIntentResponse> get(@PathVariable String orderId) {
        return ResponseEntity.ok(PaymentIntentResponse.from(getPaymentIntentUseCase.getByOrderId(orderId)));
    }
}

package kr.jemi.zaccess.payment.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.payment.application.port.in.ExpireStaleIntentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.RecoverMissedPaymentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.VerifyPendingPaymentsUseCase;
import kr.jemi.zaccess.payment.domain.IntentExpiryResult;
import kr.jemi.zaccess.payment.domain.RecoveryResult;
import kr.jemi.zaccess.payment.domain.VerificationResult;
import kr.jemi.zaccess.payment.infrastructure.in.web.dto.PaymentJobResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "PaymentAdmin", description = "결제 정합성 작업 수동 실행")
@RestController
public class PaymentAdminController {

    private final VerifyPendingPaymentsUseCase verifyPendingPaymentsUseCase;
    private final RecoverMissedPaymentsUseCase recoverMissedPaymentsUseCase;
    private final ExpireStaleIntentsUseCase expireStaleIntentsUseCase;

    public PaymentAdminController(VerifyPendingPaymentsUseCase verifyPendingPaymentsUseCase,
                                  RecoverMissedPaymentsUseCase recoverMissedPaymentsUseCase,
                                  ExpireStaleIntentsUseCase expireStaleIntentsUseCase) {
        this.verifyPendingPaymentsUseCase = verifyPendingPaymentsUseCase;
        this.recoverMissedPaymentsUseCase = recoverMissedPaymentsUseCase;
        this.expireStaleIntentsUseCase = expireStaleIntentsUseCase;
    }

    @Operation(summary = "결제 대기 예매 상태 확인", description = "이미 실행 중이면 409를 반환합니다.")
    @PostMapping("/api/admin/payments/verify")
    public ResponseEntity<PaymentJobResponse> verify(@RequestParam(defaultValue = "5") int limit) {
        VerificationResult result = verifyPendingPaymentsUseCase.verifyPending(limit)
                .orElseThrow(() -> new BusinessException(ErrorCode.JOB_ALREADY_RUNNING, "verifyPending"));
        return ResponseEntity.ok(new PaymentJobResponse("verifyPending", Map.of(
                "verified", result.verified(),
                "failed", result.failed(),
                "errors", result.errors(),
                "total", result.total())));
    }

    @Operation(summary = "누락 결제 복구")
    @PostMapping("/api/admin/payments/recover")
    public ResponseEntity<PaymentJobResponse> recover() {
        RecoveryResult result = recoverMissedPaymentsUseCase.recoverMissed()
                .orElseThrow(() -> new BusinessException(ErrorCode.JOB_ALREADY_RUNNING, "recoverMissed"));
        return ResponseEntity.ok(new PaymentJobResponse("recoverMissed", Map.of(
                "recovered", result.recovered(),
                "paidAfterExpiry", result.paidAfterExpiry(),
                "checked", result.checked())));
    }

    @Operation(summary = "만료 결제 요청 취소")
    @PostMapping("/api/admin/payments/expire-intents")
    public ResponseEntity<PaymentJobResponse> expireIntents() {
        IntentExpiryResult result = expireStaleIntentsUseCase.expireStaleIntents()
                .orElseThrow(() -> new BusinessException(ErrorCode.JOB_ALREADY_RUNNING, "expireStaleIntents"));
        return ResponseEntity.ok(new PaymentJobResponse("expireStaleIntents", Map.of(
                "cancelled", result.cancelled(),
                "found", result.found())));
    }
}

package kr.jemi.zaccess.reconciliation.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.reconciliation.application.port.in.RunReconciliationCycleUseCase;
import kr.jemi.zaccess.reconciliation.domain.CycleReport;
import kr.jemi.zaccess.reconciliation.infrastructure.in.web.dto.CycleReportResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "ReconciliationAdmin", description = "정리 사이클 수동 실행")
@RestController
public class ReconciliationAdminController {

    private final RunReconciliationCycleUseCase runReconciliationCycleUseCase;

    public ReconciliationAdminController(RunReconciliationCycleUseCase runReconciliationCycleUseCase) {
        this.runReconciliationCycleUseCase = runReconciliationCycleUseCase;
    }

    @Operation(summary = "정리 사이클 실행", description = "모든 정리 작업이 끝날 때까지 기다린 뒤 결과를 반환합니다. 이미 실행 중이면 409.")
    @PostMapping("/api/admin/reconciliation/run")
    public ResponseEntity<CycleReportResponse> run() {
        CycleReport report = runReconciliationCycleUseCase.runCycle()
                .orElseThrow(() -> new BusinessException(ErrorCode.JOB_ALREADY_RUNNING, "reconciliationCycle"));
        return ResponseEntity.ok(CycleReportResponse.from(report));
    }
}

package kr.jemi.zaccess.reconciliation.application.port.in;

import kr.jemi.zaccess.reconciliation.domain.CycleReport;

import java.util.Optional;

public interface RunReconciliationCycleUseCase {

    /**
     * 정리 작업을 모두 동시에 실행하고 끝날 때까지 기다린다.
     * 한 작업의 실패는 다른 작업을 멈추지 않는다.
     * @return 이전 사이클이 아직 진행 중이면 {@link Optional#empty()}
     */
    Optional<CycleReport> runCycle();
}

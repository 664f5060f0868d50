package kr.jemi.zaccess.inventory.application.port.in;

public interface ReleaseStockUseCase {

    /**
     * 멱등. 이미 해제되었거나 확정된 선점이면 아무것도 바꾸지 않고 false를 반환한다.
     */
    boolean release(long stockReservationId, String reason);
}

package kr.jemi.zaccess.inventory.api;

/**
 * 다른 모듈이 재고를 다룰 때 쓰는 진입점.
 * allocate/deallocate/commitReservation은 호출자의 트랜잭션 안에서만 동작한다.
 * 예매 행과 tier 행이 같은 트랜잭션에서 함께 바뀌어야 하기 때문이다.
 */
public interface InventoryFacade {

    AllocatedStock allocate(long accessTierId, int quantity);

    void deallocate(long accessTierId, int quantity);

    AllocatedStock commitReservation(long stockReservationId, String userId);

    ReservationSweep expireReservations();
}

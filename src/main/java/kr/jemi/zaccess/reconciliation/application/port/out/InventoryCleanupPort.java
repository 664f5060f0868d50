package kr.jemi.zaccess.reconciliation.application.port.out;

import kr.jemi.zaccess.reconciliation.domain.TaskCount;

public interface InventoryCleanupPort {

    TaskCount expireStockReservations();
}

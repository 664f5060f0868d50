package kr.jemi.zaccess.reconciliation.infrastructure.out.inventory;

import kr.jemi.zaccess.inventory.api.InventoryFacade;
import kr.jemi.zaccess.inventory.api.ReservationSweep;
import kr.jemi.zaccess.reconciliation.application.port.out.InventoryCleanupPort;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;
import org.springframework.stereotype.Component;

@Component
public class InventoryCleanupAdapter implements InventoryCleanupPort {

    private final InventoryFacade inventoryFacade;

    public InventoryCleanupAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public TaskCount expireStockReservations() {
        ReservationSweep sweep = inventoryFacade.expireReservations();
        return new TaskCount(sweep.released(), sweep.found());
    }
}

package kr.jemi.zaccess.booking.infrastructure.out.inventory;

import kr.jemi.zaccess.booking.application.port.out.StockAllocationPort;
import kr.jemi.zaccess.booking.domain.StockAllocation;
import kr.jemi.zaccess.inventory.api.AllocatedStock;
import kr.jemi.zaccess.inventory.api.InventoryFacade;
import org.springframework.stereotype.Component;

@Component
public class StockAllocationAdapter implements StockAllocationPort {

    private final InventoryFacade inventoryFacade;

    public StockAllocationAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public StockAllocation allocate(long accessTierId, int quantity) {
        return toAllocation(inventoryFacade.allocate(accessTierId, quantity));
    }

    @Override
    public StockAllocation commitReservation(long stockReservationId, String userId) {
        return toAllocation(inventoryFacade.commitReservation(stockReservationId, userId));
    }

    @Override
    public void release(long accessTierId, int quantity) {
        inventoryFacade.deallocate(accessTierId, quantity);
    }

    private static StockAllocation toAllocation(AllocatedStock stock) {
        return new StockAllocation(stock.accessTierId(), stock.eventId(), stock.unitPrice(), stock.quantity());
    }
}

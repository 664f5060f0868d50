package kr.jemi.zaccess.inventory.application.service;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.inventory.api.AllocatedStock;
import kr.jemi.zaccess.inventory.api.InventoryFacade;
import kr.jemi.zaccess.inventory.api.ReservationSweep;
import kr.jemi.zaccess.inventory.application.port.in.ExpireStockReservationsUseCase;
import kr.jemi.zaccess.inventory.application.port.out.AccessTierPort;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.inventory.domain.ReservationExpiryResult;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class InventoryService implements InventoryFacade {

    private final AccessTierPort accessTierPort;
    private final StockReservationWriter stockReservationWriter;
    private final ExpireStockReservationsUseCase expireStockReservationsUseCase;
    private final Clock clock;

    public InventoryService(AccessTierPort accessTierPort,
                            StockReservationWriter stockReservationWriter,
                            ExpireStockReservationsUseCase expireStockReservationsUseCase,
                            Clock clock) {
        this.accessTierPort = accessTierPort;
        this.stockReservationWriter = stockReservationWriter;
        this.expireStockReservationsUseCase = expireStockReservationsUseCase;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public AllocatedStock allocate(long accessTierId, int quantity) {
        AccessTier tier = loadTier(accessTierId);
        tier.allocate(quantity, LocalDateTime.now(clock));
        accessTierPort.update(tier);
        return toAllocatedStock(tier, quantity);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void deallocate(long accessTierId, int quantity) {
        AccessTier tier = loadTier(accessTierId);
        tier.deallocate(quantity, LocalDateTime.now(clock));
        accessTierPort.update(tier);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public AllocatedStock commitReservation(long stockReservationId, String userId) {
        StockReservation committed = stockReservationWriter.commit(
                stockReservationId, userId, LocalDateTime.now(clock));
        return toAllocatedStock(loadTier(committed.getAccessTierId()), committed.getQuantity());
    }

    @Override
    public ReservationSweep expireReservations() {
        ReservationExpiryResult result = expireStockReservationsUseCase.expireReservations();
        return new ReservationSweep(result.released(), result.found());
    }

    private AccessTier loadTier(long accessTierId) {
        return accessTierPort.findById(accessTierId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_TIER_NOT_FOUND,
                        "tierId=" + accessTierId));
    }

    private static AllocatedStock toAllocatedStock(AccessTier tier, int quantity) {
        return new AllocatedStock(tier.getId(), tier.getEventId(), tier.getPrice(), quantity);
    }
}

package kr.jemi.zaccess.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.inventory.application.port.in.CreateAccessTierCommand;
import kr.jemi.zaccess.inventory.application.port.in.CreateAccessTierUseCase;
import kr.jemi.zaccess.inventory.application.port.in.GetStockStatusUseCase;
import kr.jemi.zaccess.inventory.application.port.out.AccessTierPort;
import kr.jemi.zaccess.inventory.application.port.out.StockReservationPort;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.inventory.domain.StockStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class AccessTierService implements CreateAccessTierUseCase, GetStockStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(AccessTierService.class);

    private final AccessTierPort accessTierPort;
    private final StockReservationPort stockReservationPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;

    public AccessTierService(AccessTierPort accessTierPort,
                             StockReservationPort stockReservationPort,
                             TSID.Factory tsidFactory,
                             Clock clock) {
        this.accessTierPort = accessTierPort;
        this.stockReservationPort = stockReservationPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
    }

    @Override
    @Transactional
    public AccessTier create(CreateAccessTierCommand command) {
        AccessTier tier = AccessTier.create(tsidFactory.generate().toLong(), command.eventId(),
                command.name(), command.price(), command.totalQuantity(), LocalDateTime.now(clock));
        AccessTier saved = accessTierPort.insert(tier);
        log.info("티켓 등급 생성: tierId={}, eventId={}, total={}",
                saved.getId(), saved.getEventId(), saved.getTotalQuantity());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public StockStatus getStockStatus(long accessTierId) {
        AccessTier tier = accessTierPort.findById(accessTierId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_TIER_NOT_FOUND));
        return StockStatus.of(tier, stockReservationPort.countActiveByAccessTierId(accessTierId));
    }
}

package kr.jemi.zaccess.inventory.application.service;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;
import kr.jemi.zaccess.inventory.application.port.out.AccessTierPort;
import kr.jemi.zaccess.inventory.application.port.out.StockReservationPort;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.inventory.domain.StockReservation;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 선점 행과 tier 행을 한 트랜잭션에서 함께 바꾼다.
 * 메서드 하나가 트랜잭션 하나이므로 낙관적 락 재시도는 바깥에서 감싼다.
 */
@Service
public class StockReservationWriter {

    private final AccessTierPort accessTierPort;
    private final StockReservationPort stockReservationPort;

    public StockReservationWriter(AccessTierPort accessTierPort,
                                  StockReservationPort stockReservationPort) {
        this.accessTierPort = accessTierPort;
        this.stockReservationPort = stockReservationPort;
    }

    @Transactional
    public StockReservation hold(StockReservation reservation) {
        AccessTier tier = loadTier(reservation.getAccessTierId());
        tier.hold(reservation.getQuantity(), reservation.getCreatedAt());
        accessTierPort.update(tier);
        return stockReservationPort.insert(reservation);
    }

    @Transactional
    public boolean release(long stockReservationId, String reason, LocalDateTime now) {
        StockReservation reservation = loadReservation(stockReservationId);
        return releaseInternal(reservation, reason, now);
    }

    @Transactional
    public boolean releaseIfExpired(long stockReservationId, LocalDateTime now) {
        StockReservation reservation = loadReservation(stockReservationId);
        if (!reservation.isExpired(now)) {
            return false;
        }
        return releaseInternal(reservation, "expired", now);
    }

    /**
     * 호출자의 트랜잭션에 합류해 선점을 판매로 확정한다.
     */
    @Transactional
    public StockReservation commit(long stockReservationId, String userId, LocalDateTime now) {
        StockReservation reservation = loadReservation(stockReservationId);
        if (!reservation.isOwnedBy(userId) || reservation.isExpired(now)
                || !reservation.commit(now)) {
            throw new BusinessException(ErrorCode.STOCK_RESERVATION_NOT_USABLE,
                    "reservationId=" + stockReservationId + ", status=" + reservation.getStatus());
        }
        AccessTier tier = loadTier(reservation.getAccessTierId());
        tier.commitHold(reservation.getQuantity(), now);
        accessTierPort.update(tier);
        return stockReservationPort.update(reservation);
    }

    private boolean releaseInternal(StockReservation reservation, String reason, LocalDateTime now) {
        if (!reservation.release(reason, now)) {
            return false;
        }
        AccessTier tier = loadTier(reservation.getAccessTierId());
        tier.releaseHold(reservation.getQuantity(), now);
        accessTierPort.update(tier);
        stockReservationPort.update(reservation);
        return true;
    }

    private AccessTier loadTier(long accessTierId) {
        return accessTierPort.findById(accessTierId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_TIER_NOT_FOUND,
                        "tierId=" + accessTierId));
    }

    private StockReservation loadReservation(long stockReservationId) {
        return stockReservationPort.findById(stockReservationId)
                .orElseThrow(() -> new BusinessException(ErrorCode.STOCK_RESERVATION_NOT_FOUND,
                        "reservationId=" + stockReservationId));
    }
}

package kr.jemi.zaccess.inventory.domain;

import kr.jemi.zaccess.common.exception.BusinessException;
import kr.jemi.zaccess.common.exception.ErrorCode;

public class InsufficientStockException extends BusinessException {

    private final long accessTierId;
    private final int requested;
    private final int available;

    public InsufficientStockException(long accessTierId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                "tierId=" + accessTierId + ", 요청=" + requested + ", 잔여=" + available);
        this.accessTierId = accessTierId;
        this.requested = requested;
        this.available = available;
    }

    public long getAccessTierId() {
        return accessTierId;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}

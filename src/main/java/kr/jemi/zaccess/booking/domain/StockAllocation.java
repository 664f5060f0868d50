package kr.jemi.zaccess.booking.domain;

import java.math.BigDecimal;

public record StockAllocation(long accessTierId, long eventId, BigDecimal unitPrice, int quantity) {

    public BigDecimal totalAmount() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}

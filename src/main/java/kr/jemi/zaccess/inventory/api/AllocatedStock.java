package kr.jemi.zaccess.inventory.api;

import java.math.BigDecimal;

public record AllocatedStock(long accessTierId, long eventId, BigDecimal unitPrice, int quantity) {
}

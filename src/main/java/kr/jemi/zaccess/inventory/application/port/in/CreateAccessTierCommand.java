package kr.jemi.zaccess.inventory.application.port.in;

import java.math.BigDecimal;

public record CreateAccessTierCommand(long eventId, String name, BigDecimal price, int totalQuantity) {
}

package kr.jemi.zaccess.inventory.infrastructure.in.web.dto;

public record ReleaseStockResponse(long reservationId, boolean released) {
}

package kr.jemi.zaccess.inventory.domain;

public enum StockReservationStatus {
    RESERVED,
    RELEASED,
    COMMITTED
}

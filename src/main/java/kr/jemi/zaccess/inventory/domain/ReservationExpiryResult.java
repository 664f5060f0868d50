package kr.jemi.zaccess.inventory.domain;

public record ReservationExpiryResult(int released, int found) {
}

package kr.jemi.zaccess.inventory.api;

public record ReservationSweep(int released, int found) {
}

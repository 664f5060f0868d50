package kr.jemi.zaccess.booking.api;

public record BookingSweep(int expired, int found) {
}

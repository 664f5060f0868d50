package kr.jemi.zaccess.reconciliation.domain;

public enum CleanupTask {
    PAYMENT_INTENT_EXPIRY,
    STOCK_RESERVATION_EXPIRY,
    WEBHOOK_LOG_ROTATION,
    BOOKING_EXPIRY,
    AUDIT_LOG_ARCHIVAL
}

package kr.jemi.zaccess.payment.domain;

public enum PaymentIntentStatus {
    PENDING,
    PROCESSING,
    PAID,
    CANCELLED;

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }
}

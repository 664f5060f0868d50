package kr.jemi.zaccess.payment.domain;

import java.util.Locale;

/**
 * 결제 게이트웨이가 돌려주는 transaction_status 값.
 */
public enum GatewayTransactionStatus {
    SETTLEMENT,
    CAPTURE,
    PENDING,
    AUTHORIZE,
    DENY,
    CANCEL,
    EXPIRE,
    FAILURE,
    UNKNOWN;

    public static GatewayTransactionStatus from(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isSuccess() {
        return this == SETTLEMENT || this == CAPTURE;
    }

    public boolean isFailure() {
        return this == DENY || this == CANCEL || this == EXPIRE || this == FAILURE;
    }

    public boolean isPending() {
        return this == PENDING || this == AUTHORIZE;
    }
}

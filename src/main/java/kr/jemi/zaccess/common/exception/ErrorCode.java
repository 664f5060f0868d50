package kr.jemi.zaccess.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    INVALID_REQUEST(400, "요청 값이 올바르지 않습니다"),
    ACCESS_TIER_NOT_FOUND(404, "티켓 등급을 찾을 수 없습니다"),
    INSUFFICIENT_STOCK(409, "잔여 재고가 부족합니다"),
    CONCURRENT_MODIFICATION(409, "동시 요청이 많아 처리하지 못했습니다. 다시 시도해주세요"),
    STOCK_RESERVATION_NOT_FOUND(404, "재고 선점 정보를 찾을 수 없습니다"),
    STOCK_RESERVATION_NOT_USABLE(409, "사용할 수 없는 재고 선점입니다"),
    BOOKING_NOT_FOUND(404, "예매를 찾을 수 없습니다"),
    PAYMENT_INTENT_NOT_FOUND(404, "결제 요청을 찾을 수 없습니다"),
    PAYMENT_INTENT_LOCKED(409, "이미 진행 중인 결제 요청이 있습니다"),
    PAYMENT_GATEWAY_ERROR(502, "결제 게이트웨이 조회에 실패했습니다"),
    JOB_ALREADY_RUNNING(409, "이미 실행 중인 작업입니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}

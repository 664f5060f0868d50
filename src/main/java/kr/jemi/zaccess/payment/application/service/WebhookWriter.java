package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.payment.application.port.out.BookingPaymentPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentAuditPort;
import kr.jemi.zaccess.payment.application.port.out.PaymentIntentPort;
import kr.jemi.zaccess.payment.application.port.out.WebhookLogPort;
import kr.jemi.zaccess.payment.domain.GatewayTransactionStatus;
import kr.jemi.zaccess.payment.domain.WebhookLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 웹훅 기록과 상태 반영을 한 트랜잭션으로 묶는다.
 * 반영이 실패하면 기록도 롤백되어 게이트웨이의 재전송을 다시 받을 수 있다.
 */
@Service
public class WebhookWriter {

    private static final Logger log = LoggerFactory.getLogger(WebhookWriter.class);

    static final String PAID_AFTER_CLOSE_EVENT = "PAYMENT_AFTER_CLOSE";

    private final WebhookLogPort webhookLogPort;
    private final BookingPaymentPort bookingPaymentPort;
    private final PaymentIntentPort paymentIntentPort;
    private final PaymentIntentWriter paymentIntentWriter;
    private final PaymentAuditPort paymentAuditPort;

    public WebhookWriter(WebhookLogPort webhookLogPort,
                         BookingPaymentPort bookingPaymentPort,
                         PaymentIntentPort paymentIntentPort,
                         PaymentIntentWriter paymentIntentWriter,
                         PaymentAuditPort paymentAuditPort) {
        this.webhookLogPort = webhookLogPort;
        this.bookingPaymentPort = bookingPaymentPort;
        this.paymentIntentPort = paymentIntentPort;
        this.paymentIntentWriter = paymentIntentWriter;
        this.paymentAuditPort = paymentAuditPort;
    }

    /**
     * @return 예매나 결제 요청의 상태가 바뀌었으면 true
     */
    @Transactional
    public boolean recordAndApply(WebhookLog webhookLog, LocalDateTime now) {
        webhookLogPort.insert(webhookLog);

        String orderId = webhookLog.orderId();
        GatewayTransactionStatus status = GatewayTransactionStatus.from(webhookLog.transactionStatus());

        if (bookingPaymentPort.exists(orderId)) {
            if (status.isSuccess()) {
                if (bookingPaymentPort.confirmPayment(orderId)) {
                    return true;
                }
                if (!bookingPaymentPort.isPaid(orderId)) {
                    alertPaidAfterClose(orderId, status);
                }
                return false;
            }
            if (status.isFailure()) {
                return bookingPaymentPort.failPayment(orderId);
            }
            return false;
        }
        return paymentIntentPort.findByOrderId(orderId)
                .map(intent -> paymentIntentWriter.applyGatewayStatus(intent, status, now))
                .orElseGet(() -> {
                    log.warn("알 수 없는 주문의 웹훅: orderId={}, status={}", orderId, status);
                    return false;
                });
    }

    /**
     * 만료·취소로 이미 재고를 돌려준 예매에 결제 완료가 도착했다. 자동으로 되돌리지 않고 운영자에게 알린다.
     */
    private void alertPaidAfterClose(String bookingCode, GatewayTransactionStatus status) {
        log.warn("[ALERT] 종료된 예매에 결제 완료 웹훅 수신: bookingCode={}, status={}. 환불 또는 수동 처리가 필요합니다",
                bookingCode, status);
        try {
            paymentAuditPort.alert(PAID_AFTER_CLOSE_EVENT,
                    "종료된 예매에 결제 완료 웹훅 수신: " + bookingCode,
                    Map.of("bookingCode", bookingCode, "transactionStatus", status.name()));
        } catch (Exception e) {
            log.error("결제 이상 감사 로그 기록 실패: bookingCode={}", bookingCode, e);
        }
    }

    @Transactional
    public int deleteBatch(LocalDateTime cutoff, int limit) {
        List<Long> ids = webhookLogPort.findIdsProcessedBefore(cutoff, limit);
        if (ids.isEmpty()) {
            return 0;
        }
        return webhookLogPort.deleteByIds(ids);
    }
}

package kr.jemi.zaccess.payment.application.port.out;

import java.util.Map;

public interface PaymentAuditPort {

    /** 운영자 확인이 필요한 이상 징후를 CRITICAL 등급으로 남긴다 */
    void alert(String eventType, String description, Map<String, Object> metadata);
}

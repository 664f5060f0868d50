package kr.jemi.zaccess.payment.infrastructure.out.audit;

import kr.jemi.zaccess.audit.api.AuditFacade;
import kr.jemi.zaccess.audit.api.AuditRecord;
import kr.jemi.zaccess.audit.api.AuditSeverity;
import kr.jemi.zaccess.payment.application.port.out.PaymentAuditPort;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PaymentAuditAdapter implements PaymentAuditPort {

    private static final String CATEGORY = "PAYMENT";

    private final AuditFacade auditFacade;

    public PaymentAuditAdapter(AuditFacade auditFacade) {
        this.auditFacade = auditFacade;
    }

    @Override
    public void alert(String eventType, String description, Map<String, Object> metadata) {
        auditFacade.record(new AuditRecord(eventType, CATEGORY, AuditSeverity.CRITICAL, description, metadata));
    }
}

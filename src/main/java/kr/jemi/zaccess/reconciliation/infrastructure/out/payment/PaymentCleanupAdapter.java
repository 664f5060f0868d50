package kr.jemi.zaccess.reconciliation.infrastructure.out.payment;

import kr.jemi.zaccess.payment.api.PaymentFacade;
import kr.jemi.zaccess.reconciliation.application.port.out.PaymentCleanupPort;
import kr.jemi.zaccess.reconciliation.domain.TaskCount;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PaymentCleanupAdapter implements PaymentCleanupPort {

    private final PaymentFacade paymentFacade;

    public PaymentCleanupAdapter(PaymentFacade paymentFacade) {
        this.paymentFacade = paymentFacade;
    }

    @Override
    public Optional<TaskCount> expireStaleIntents() {
        return paymentFacade.expireStaleIntents()
                .map(sweep -> new TaskCount(sweep.cancelled(), sweep.found()));
    }

    @Override
    public TaskCount purgeWebhookLogs() {
        return TaskCount.of(paymentFacade.purgeWebhookLogs());
    }
}

package kr.jemi.zaccess.payment.application.service;

import kr.jemi.zaccess.payment.api.IntentSweep;
import kr.jemi.zaccess.payment.api.PaymentFacade;
import kr.jemi.zaccess.payment.application.port.in.ExpireStaleIntentsUseCase;
import kr.jemi.zaccess.payment.application.port.in.PurgeWebhookLogsUseCase;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class PaymentMaintenanceService implements PaymentFacade {

    private final ExpireStaleIntentsUseCase expireStaleIntentsUseCase;
    private final PurgeWebhookLogsUseCase purgeWebhookLogsUseCase;

    public PaymentMaintenanceService(ExpireStaleIntentsUseCase expireStaleIntentsUseCase,
                                     PurgeWebhookLogsUseCase purgeWebhookLogsUseCase) {
        this.expireStaleIntentsUseCase = expireStaleIntentsUseCase;
        this.purgeWebhookLogsUseCase = purgeWebhookLogsUseCase;
    }

    @Override
    public Optional<IntentSweep> expireStaleIntents() {
        return expireStaleIntentsUseCase.expireStaleIntents()
                .map(result -> new IntentSweep(result.cancelled(), result.found()));
    }

    @Override
    public int purgeWebhookLogs() {
        return purgeWebhookLogsUseCase.purgeExpired();
    }
}

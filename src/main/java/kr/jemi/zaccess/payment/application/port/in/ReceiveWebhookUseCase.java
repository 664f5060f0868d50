package kr.jemi.zaccess.payment.application.port.in;

import kr.jemi.zaccess.payment.domain.WebhookOutcome;

public interface ReceiveWebhookUseCase {

    WebhookOutcome receive(ReceiveWebhookCommand command);
}

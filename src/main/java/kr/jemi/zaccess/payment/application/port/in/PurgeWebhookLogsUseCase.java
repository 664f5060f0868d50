package kr.jemi.zaccess.payment.application.port.in;

public interface PurgeWebhookLogsUseCase {

    /**
     * @return 삭제한 웹훅 로그 건수
     */
    int purgeExpired();
}

package kr.jemi.zaccess.payment.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zaccess.payment.application.port.in.ReceiveWebhookCommand;
import kr.jemi.zaccess.payment.application.port.out.WebhookLogPort;
import kr.jemi.zaccess.payment.domain.WebhookLog;
import kr.jemi.zaccess.payment.domain.WebhookOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Duration RETENTION = Duration.ofDays(30);
    private static final int PURGE_BATCH_SIZE = 100;

    @Mock
    private WebhookWriter webhookWriter;

    @Mock
    private WebhookLogPort webhookLogPort;

    private WebhookService service;

    private final ReceiveWebhookCommand command =
            new ReceiveWebhookCommand("BK1", "settlement", "sig-1", "{\"order_id\":\"BK1\"}");

    @BeforeEach
    void setUp() {
        service = new WebhookService(webhookWriter, webhookLogPort, TSID.Factory.newInstance256(0), CLOCK,
                RETENTION, PURGE_BATCH_SIZE, Duration.ZERO);
    }

    @Nested
    @DisplayName("receive()")
    class Receive {

        @Test
        @DisplayName("처음 받은 웹훅은 기록하고 상태를 반영한다")
        void recordsAndApplies() {
            // given
            String webhookId = WebhookLog.webhookIdOf("BK1", "settlement", "sig-1");
            given(webhookLogPort.existsByWebhookId(webhookId)).willReturn(false);
            given(webhookWriter.recordAndApply(any(WebhookLog.class), eq(NOW))).willReturn(true);

            // when
            WebhookOutcome outcome = service.receive(command);

            // then
            assertThat(outcome).isEqualTo(WebhookOutcome.processed(true));
        }

        @Test
        @DisplayName("이미 기록된 웹훅은 반영하지 않고 중복으로 응답한다")
        void ignoresKnownWebhook() {
            // given
            given(webhookLogPort.existsByWebhookId(anyString())).willReturn(true);

            // when
            WebhookOutcome outcome = service.receive(command);

            // then
            assertThat(outcome.duplicate()).isTrue();
            then(webhookWriter).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("동시에 들어온 같은 웹훅이 유니크 제약에 걸리면 중복으로 응답한다")
        void concurrentDuplicate() {
            // given
            given(webhookLogPort.existsByWebhookId(anyString())).willReturn(false);
            given(webhookWriter.recordAndApply(any(WebhookLog.class), eq(NOW)))
                    .willThrow(new DataIntegrityViolationException("uk_webhook_id"));

            // when
            WebhookOutcome outcome = service.receive(command);

            // then
            assertThat(outcome).isEqualTo(WebhookOutcome.duplicated());
        }

        @Test
        @DisplayName("반영 중 다른 오류는 그대로 던진다")
        void propagatesOtherFailures() {
            // given
            given(webhookLogPort.existsByWebhookId(anyString())).willReturn(false);
            given(webhookWriter.recordAndApply(any(WebhookLog.class), eq(NOW)))
                    .willThrow(new IllegalStateException("boom"));

            // when & then
            assertThatThrownBy(() -> service.receive(command)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("purgeExpired()")
    class PurgeExpired {

        @Test
        @DisplayName("보관 기간이 지난 로그를 짧은 배치가 나올 때까지 지운다")
        void deletesUntilShortBatch() {
            // given
            LocalDateTime cutoff = NOW.minus(RETENTION);
            given(webhookWriter.deleteBatch(cutoff, PURGE_BATCH_SIZE))
                    .willReturn(PURGE_BATCH_SIZE)
                    .willReturn(PURGE_BATCH_SIZE)
                    .willReturn(7);

            // when
            int purged = service.purgeExpired();

            // then
            assertThat(purged).isEqualTo(207);
            then(webhookWriter).should(times(3)).deleteBatch(cutoff, PURGE_BATCH_SIZE);
        }

        @Test
        @DisplayName("지울 것이 없으면 0")
        void nothingToDelete() {
            given(webhookWriter.deleteBatch(any(LocalDateTime.class), eq(PURGE_BATCH_SIZE))).willReturn(0);

            assertThat(service.purgeExpired()).isZero();
        }
    }
}

package kr.jemi.zaccess.integration;

import kr.jemi.zaccess.booking.application.port.out.BookingNotificationPort;
import kr.jemi.zaccess.booking.domain.EventContext;
import kr.jemi.zaccess.booking.domain.PaymentExpiredEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.modulith.events.core.EventPublicationRegistry;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.timeout;

class AsyncEventIntegrationTest extends IntegrationTestBase {

    @Autowired
    ApplicationEventPublisher eventPublisher;

    @Autowired
    TransactionTemplate transactionTemplate;

    @Autowired
    EventPublicationRegistry eventPublicationRegistry;

    @MockitoBean
    BookingNotificationPort bookingNotificationPort;

    @Test
    @DisplayName("알림 전송이 실패해도 호출자에게 예외가 전파되지 않고, 이벤트는 미완료로 남아 재발행 대상이 된다")
    void notificationFailureLeavesPublicationIncomplete() {
        // given
        willThrow(new IllegalStateException("알림 서버 응답 없음"))
                .given(bookingNotificationPort).sendPaymentExpired(any());
        PaymentExpiredEvent event = expiredEvent("BK-FAIL");

        // when
        assertThatCode(() -> transactionTemplate.executeWithoutResult(status -> eventPublisher.publishEvent(event)))
                .doesNotThrowAnyException();

        // then
        then(bookingNotificationPort).should(timeout(5000)).sendPaymentExpired(event);
        await().atMost(5, SECONDS).untilAsserted(() ->
                assertThat(eventPublicationRegistry.findIncompletePublications())
                        .anyMatch(publication -> event.equals(publication.getEvent()))
        );
    }

    @Test
    @DisplayName("알림 전송이 성공하면 이벤트 발행이 완료 처리된다")
    void notificationSuccessCompletesPublication() {
        // given
        PaymentExpiredEvent event = expiredEvent("BK-OK");

        // when
        transactionTemplate.executeWithoutResult(status -> eventPublisher.publishEvent(event));

        // then
        then(bookingNotificationPort).should(timeout(5000)).sendPaymentExpired(event);
        await().atMost(5, SECONDS).untilAsserted(() ->
                assertThat(eventPublicationRegistry.findIncompletePublications())
                        .noneMatch(publication -> event.equals(publication.getEvent()))
        );
    }

    private PaymentExpiredEvent expiredEvent(String bookingCode) {
        return new PaymentExpiredEvent("user-1", bookingCode,
                new EventContext(1L, 1L, 1, new BigDecimal("50000"), LocalDateTime.now(clock)));
    }
}

package kr.jemi.zaccess.common.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 리스너가 실패해 완료되지 않은 결제 알림 이벤트를 다시 발행한다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private static final Duration RESUBMIT_AFTER = Duration.ofMinutes(5);

    private final IncompleteEventPublications incompleteEventPublications;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications) {
        this.incompleteEventPublications = incompleteEventPublications;
    }

    @Scheduled(cron = "${zaccess.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${zaccess.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${zaccess.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        try {
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(RESUBMIT_AFTER);
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 스케줄러 실패", e);
        }
    }
}

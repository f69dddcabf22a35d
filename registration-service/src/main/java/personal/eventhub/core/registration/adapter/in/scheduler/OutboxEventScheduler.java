package personal.eventhub.core.registration.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import personal.eventhub.core.registration.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox 릴레이 (Driving Adapter)
 * 등록/취소 트랜잭션이 남긴 PENDING 행을 Kafka 로 넘긴다. outbox.relay.enabled=false 로 끈다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "outbox.relay", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    // fixedDelay: 이전 배치가 끝난 뒤부터 간격을 잰다 (동시 실행 없음)
    @Scheduled(fixedDelayString = "${outbox.relay.fixed-delay-ms:500}")
    public void relayPendingEvents() {
        try {
            int published = publishPendingEventsUseCase.publishPendingEvents();
            if (published > 0) {
                log.debug("Outbox relay batch done: published={}", published);
            }
        } catch (DataAccessException | TransactionException e) {
            // 저장소 장애 중에는 다음 주기에 다시 시도한다
            log.warn("Outbox relay skipped, datastore unavailable: {}", e.getMessage());
        }
    }
}

package personal.eventhub.core.registration.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.eventhub.core.registration.application.port.in.PublishPendingEventsUseCase;
import personal.eventhub.core.registration.application.port.out.OutboxEventRepository;
import personal.eventhub.core.registration.application.port.out.RegistrationEventPublisher;
import personal.eventhub.core.registration.domain.model.OutboxEvent;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 이벤트를 발행 처리하는 도메인 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final RegistrationEventPublisher eventPublisher;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = RegistrationEventType.valueOf(event.eventType()).topic();

                // Key: registrationId (생성/취소 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished());
                publishedCount++;

            } catch (RuntimeException e) {
                OutboxEvent failed = event.recordFailure();
                log.error("Failed to publish event: id={}, retryCount={}, status={}",
                        event.id(), failed.retryCount(), failed.status(), e);
                outboxEventRepository.save(failed);
            }
        }
        return publishedCount;
    }
}

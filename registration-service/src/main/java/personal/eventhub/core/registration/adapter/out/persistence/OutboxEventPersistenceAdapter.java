package personal.eventhub.core.registration.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.eventhub.core.registration.application.port.out.OutboxEventRepository;
import personal.eventhub.core.registration.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * 릴레이 상태만 갱신하고 payload 는 건드리지 않는다.
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        OutboxEventEntity entity = jpaOutboxEventRepository.findById(outboxEvent.id())
                .orElseThrow(() -> new IllegalStateException("Outbox event not found: id=" + outboxEvent.id()));
        entity.applyRelayState(outboxEvent);
        return jpaOutboxEventRepository.save(entity).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        return jpaOutboxEventRepository.findTop100ByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        OutboxEvent.MAX_RETRY_COUNT)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}

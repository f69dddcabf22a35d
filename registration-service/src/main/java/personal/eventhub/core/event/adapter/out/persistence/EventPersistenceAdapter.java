package personal.eventhub.core.event.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.core.event.application.port.out.EventRepository;
import personal.eventhub.core.event.domain.exception.EventNotFoundException;
import personal.eventhub.core.event.domain.model.Event;

import java.util.Optional;

/**
 * Event Persistence Adapter
 * JPA를 사용한 이벤트 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventPersistenceAdapter implements EventRepository {

    private final JpaEventRepository jpaEventRepository;

    @Override
    public Optional<Event> findById(Long eventId) {
        log.debug("Finding event: eventId={}", eventId);
        return jpaEventRepository.findById(eventId)
                .map(EventEntity::toDomain);
    }

    @Override
    public Event save(Event event) {
        log.debug("Saving event: eventId={}", event.id());

        if (event.id() == null) {
            return jpaEventRepository.save(EventEntity.fromDomain(event)).toDomain();
        }

        EventEntity entity = jpaEventRepository.findById(event.id())
                .orElseThrow(() -> new EventNotFoundException(event.id()));
        entity.rename(event.title());
        return jpaEventRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public void deleteById(Long eventId) {
        log.debug("Deleting event: eventId={}", eventId);
        jpaEventRepository.deleteById(eventId);
    }
}

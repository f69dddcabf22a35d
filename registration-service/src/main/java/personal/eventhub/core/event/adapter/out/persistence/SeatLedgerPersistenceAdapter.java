package personal.eventhub.core.event.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.core.event.application.port.out.SeatLedger;
import personal.eventhub.core.event.domain.model.Event;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Seat Ledger Persistence Adapter
 * 행 락(FOR UPDATE)과 조건부 UPDATE 로 잔여 좌석을 관리하는 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeatLedgerPersistenceAdapter implements SeatLedger {

    private final JpaEventRepository jpaEventRepository;

    @Override
    public Optional<Event> lockForUpdate(Long eventId) {
        log.debug("Acquiring event row lock: eventId={}", eventId);
        Optional<Event> locked = jpaEventRepository.findByIdForUpdate(eventId)
                .map(EventEntity::toDomain);
        locked.ifPresent(event -> log.debug("Event row locked: eventId={}, availableSeats={}",
                event.id(), event.availableSeats()));
        return locked;
    }

    @Override
    public boolean reserve(Long eventId) {
        int updated = jpaEventRepository.decreaseAvailableSeats(eventId, LocalDateTime.now());
        log.debug("Seat reserve attempted: eventId={}, updated={}", eventId, updated);
        return updated == 1;
    }

    @Override
    public void release(Long eventId) {
        int updated = jpaEventRepository.increaseAvailableSeats(eventId, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Seat release affected no rows: eventId={}", eventId);
            return;
        }
        log.debug("Seat released: eventId={}", eventId);
    }
}

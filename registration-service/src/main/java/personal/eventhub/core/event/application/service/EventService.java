package personal.eventhub.core.event.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;
import personal.eventhub.core.event.application.port.in.CreateEventCommand;
import personal.eventhub.core.event.application.port.in.GetEventUseCase;
import personal.eventhub.core.event.application.port.in.ManageEventUseCase;
import personal.eventhub.core.event.application.port.in.UpdateEventCommand;
import personal.eventhub.core.event.application.port.out.EventRegistrationPort;
import personal.eventhub.core.event.application.port.out.EventRepository;
import personal.eventhub.core.event.application.port.out.SeatLedger;
import personal.eventhub.core.event.domain.exception.EventHasRegistrationsException;
import personal.eventhub.core.event.domain.exception.EventNotFoundException;
import personal.eventhub.core.event.domain.model.Event;
import personal.eventhub.core.user.application.port.in.ValidateUserUseCase;

/**
 * Event Application Service
 * 이벤트 생성/조회/수정/삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EventService implements GetEventUseCase, ManageEventUseCase {

    private final EventRepository eventRepository;
    private final SeatLedger seatLedger;
    private final EventRegistrationPort eventRegistrationPort;
    private final ValidateUserUseCase validateUserUseCase;

    @Override
    public Event getEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> {
                    log.warn("Event not found: eventId={}", eventId);
                    return new EventNotFoundException(eventId);
                });
    }

    @Override
    @Transactional
    public Event createEvent(CreateEventCommand command) {
        log.info("Creating event: organizerId={}, capacity={}", command.organizerId(), command.capacity());

        validateUserUseCase.validateUser(command.organizerId());

        Event saved = eventRepository.save(
                Event.create(command.title(), command.capacity(), command.organizerId()));

        log.info("Event created: eventId={}, capacity={}", saved.id(), saved.capacity());
        return saved;
    }

    @Override
    @Transactional
    public Event updateEvent(UpdateEventCommand command) {
        log.info("Updating event: eventId={}", command.eventId());

        Event event = getEvent(command.eventId());

        if (command.capacity() != null && command.capacity() != event.capacity()) {
            log.warn("Capacity change rejected: eventId={}, current={}, requested={}",
                    event.id(), event.capacity(), command.capacity());
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Event capacity cannot be changed after creation");
        }

        return eventRepository.save(event.rename(command.title()));
    }

    @Override
    @Transactional
    public void deleteEvent(Long eventId) {
        log.info("Deleting event: eventId={}", eventId);

        // 등록 트랜잭션과 동일하게 이벤트 행을 먼저 잠근다
        seatLedger.lockForUpdate(eventId)
                .orElseThrow(() -> {
                    log.warn("Event not found for deletion: eventId={}", eventId);
                    return new EventNotFoundException(eventId);
                });

        long registrations = eventRegistrationPort.countRegistrations(eventId);
        if (registrations > 0) {
            log.warn("Event still has registrations: eventId={}, count={}", eventId, registrations);
            throw new EventHasRegistrationsException(eventId, registrations);
        }

        eventRepository.deleteById(eventId);
    }
}

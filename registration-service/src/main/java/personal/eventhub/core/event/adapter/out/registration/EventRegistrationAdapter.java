package personal.eventhub.core.event.adapter.out.registration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.core.event.application.port.out.EventRegistrationPort;
import personal.eventhub.core.registration.application.port.out.RegistrationRepository;

/**
 * Event Registration Adapter
 * 이벤트 삭제 가능 여부 확인을 위한 등록 수 조회 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventRegistrationAdapter implements EventRegistrationPort {

    private final RegistrationRepository registrationRepository;

    @Override
    public long countRegistrations(Long eventId) {
        long count = registrationRepository.countByEventId(eventId);
        log.debug("Event registration count: eventId={}, count={}", eventId, count);
        return count;
    }
}

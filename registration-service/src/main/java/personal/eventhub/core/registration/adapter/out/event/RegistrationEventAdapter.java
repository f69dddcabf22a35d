package personal.eventhub.core.registration.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.core.registration.adapter.out.persistence.JpaOutboxEventRepository;
import personal.eventhub.core.registration.adapter.out.persistence.OutboxEventFactory;
import personal.eventhub.core.registration.application.port.out.RegistrationEventPort;
import personal.eventhub.core.registration.domain.model.Registration;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

/**
 * Registration Event Adapter
 * Outbox 패턴을 사용한 등록 이벤트 기록 구현체
 * 호출자의 트랜잭션에 참여하므로 등록 변경과 함께 커밋/롤백된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationEventAdapter implements RegistrationEventPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishRegistrationEvent(Registration registration, RegistrationEventType eventType) {
        jpaOutboxEventRepository.save(outboxEventFactory.create(registration, eventType));
        log.debug("Registration event recorded: registrationId={}, type={}", registration.id(), eventType);
    }
}

package personal.eventhub.core.registration.application.port.out;

import personal.eventhub.core.registration.domain.model.Registration;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

/**
 * Registration Event Port
 * 등록 이벤트 기록 책임 (Outbox 패턴, 호출자 트랜잭션에 참여)
 */
public interface RegistrationEventPort {

    /**
     * @param registration 대상 등록
     * @param eventType    이벤트 종류
     */
    void publishRegistrationEvent(Registration registration, RegistrationEventType eventType);
}

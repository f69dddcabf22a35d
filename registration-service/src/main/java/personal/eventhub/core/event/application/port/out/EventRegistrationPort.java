package personal.eventhub.core.event.application.port.out;

/**
 * Event Registration Port
 * 이벤트 삭제 전 등록 수 확인 (registration 컨텍스트 위임)
 */
public interface EventRegistrationPort {

    long countRegistrations(Long eventId);
}

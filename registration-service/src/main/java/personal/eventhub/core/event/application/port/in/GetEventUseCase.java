package personal.eventhub.core.event.application.port.in;

import personal.eventhub.core.event.domain.model.Event;

/**
 * Get Event UseCase (Input Port)
 */
public interface GetEventUseCase {

    /**
     * @param eventId 이벤트 ID
     * @return 이벤트 정보 (잔여 좌석 포함)
     * @throws personal.eventhub.core.event.domain.exception.EventNotFoundException 이벤트가 없을 때
     */
    Event getEvent(Long eventId);
}

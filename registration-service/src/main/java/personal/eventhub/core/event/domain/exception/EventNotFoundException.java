package personal.eventhub.core.event.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Event Not Found Exception
 * 이벤트를 찾을 수 없을 때 발생하는 예외
 */
public class EventNotFoundException extends BusinessException {

    public EventNotFoundException(Long eventId) {
        super(ErrorCode.EVENT_NOT_FOUND, String.format("Event not found: eventId=%d", eventId));
    }
}

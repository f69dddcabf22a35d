package personal.eventhub.core.event.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

public class EventHasRegistrationsException extends BusinessException {

    public EventHasRegistrationsException(Long eventId, long registrationCount) {
        super(ErrorCode.EVENT_HAS_REGISTRATIONS,
                String.format("Event still has registrations: eventId=%d, count=%d", eventId, registrationCount));
    }
}

package personal.eventhub.core.event.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Update Event Command
 * capacity는 선택값이며, 기존 정원과 다르면 거부된다
 */
public record UpdateEventCommand(
        Long eventId,
        String title,
        Integer capacity
) {
    public UpdateEventCommand {
        if (eventId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event ID cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event title cannot be null or blank");
        }
    }
}

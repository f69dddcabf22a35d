package personal.eventhub.core.event.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Create Event Command
 */
public record CreateEventCommand(
        String title,
        Integer capacity,
        Long organizerId
) {
    public CreateEventCommand {
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event title cannot be null or blank");
        }
        if (capacity == null || capacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event capacity must be positive");
        }
        if (organizerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Organizer ID cannot be null");
        }
    }
}

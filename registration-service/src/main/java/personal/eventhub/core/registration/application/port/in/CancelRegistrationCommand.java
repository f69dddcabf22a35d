package personal.eventhub.core.registration.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Cancel Registration Command
 */
public record CancelRegistrationCommand(
        Long userId,
        Long eventId
) {
    public CancelRegistrationCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (eventId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event ID cannot be null");
        }
    }
}

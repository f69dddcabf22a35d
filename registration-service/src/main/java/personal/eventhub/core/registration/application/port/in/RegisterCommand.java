package personal.eventhub.core.registration.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Register Command
 * 이벤트 등록 커맨드
 */
public record RegisterCommand(
        Long userId,
        Long eventId
) {
    public RegisterCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (eventId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event ID cannot be null");
        }
    }
}

package personal.eventhub.core.user.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;
import personal.eventhub.core.user.domain.model.UserRole;

/**
 * Update User Command
 * role이 null이면 기존 역할 유지
 */
public record UpdateUserCommand(
        Long userId,
        String name,
        String email,
        UserRole role
) {
    public UpdateUserCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
    }
}

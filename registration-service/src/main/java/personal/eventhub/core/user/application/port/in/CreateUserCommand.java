package personal.eventhub.core.user.application.port.in;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;
import personal.eventhub.core.user.domain.model.UserRole;

/**
 * Create User Command
 */
public record CreateUserCommand(
        String name,
        String email,
        UserRole role
) {
    public CreateUserCommand {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
    }
}

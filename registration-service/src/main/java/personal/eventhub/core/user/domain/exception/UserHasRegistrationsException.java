package personal.eventhub.core.user.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

public class UserHasRegistrationsException extends BusinessException {

    public UserHasRegistrationsException(Long userId) {
        super(ErrorCode.USER_HAS_REGISTRATIONS,
                String.format("User still holds registrations: userId=%d", userId));
    }
}

package personal.eventhub.core.user.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * User Not Found Exception
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends BusinessException {

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, String.format("User not found: userId=%d", userId));
    }

    public UserNotFoundException(String email) {
        super(ErrorCode.USER_NOT_FOUND, String.format("User not found: email=%s", email));
    }
}

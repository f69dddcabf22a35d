package personal.eventhub.core.user.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * 이메일 중복 시 발생하는 예외
 */
public class UserAlreadyExistsException extends BusinessException {

    public UserAlreadyExistsException(String email) {
        super(ErrorCode.USER_ALREADY_EXISTS, String.format("User already exists: email=%s", email));
    }
}

package personal.eventhub.core.registration.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Registration Not Found Exception
 * 등록 정보를 찾을 수 없을 때 발생하는 예외
 */
public class RegistrationNotFoundException extends BusinessException {

    public RegistrationNotFoundException(Long registrationId) {
        super(ErrorCode.REGISTRATION_NOT_FOUND,
                String.format("Registration not found: registrationId=%d", registrationId));
    }
}

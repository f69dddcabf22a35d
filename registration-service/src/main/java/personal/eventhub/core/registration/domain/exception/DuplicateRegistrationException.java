package personal.eventhub.core.registration.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * (user_id, event_id) 유니크 제약 위반
 * 저장소 어댑터가 번역하여 던지며, 등록 트랜잭션에서 ALREADY_REGISTERED 로 처리된다
 */
public class DuplicateRegistrationException extends BusinessException {

    public DuplicateRegistrationException(Long userId, Long eventId, Throwable cause) {
        super(ErrorCode.ALREADY_REGISTERED,
                String.format("Duplicate registration: userId=%d, eventId=%d", userId, eventId), cause);
    }
}

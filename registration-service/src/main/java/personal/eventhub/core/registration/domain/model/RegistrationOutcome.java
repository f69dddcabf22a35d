package personal.eventhub.core.registration.domain.model;

import personal.eventhub.common.exception.ErrorCode;

/**
 * 등록 시도의 결과
 * 예상 가능한 비즈니스 결과는 예외가 아닌 값으로 반환된다
 */
public enum RegistrationOutcome {
    REGISTERED(null),
    ALREADY_REGISTERED(ErrorCode.ALREADY_REGISTERED),
    EVENT_FULL(ErrorCode.EVENT_FULL),
    EVENT_NOT_FOUND(ErrorCode.EVENT_NOT_FOUND),
    USER_NOT_FOUND(ErrorCode.USER_NOT_FOUND),
    TRANSIENT_FAILURE(ErrorCode.TRANSIENT_FAILURE);  // 재시도 안전

    private final ErrorCode errorCode;

    RegistrationOutcome(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * 실패 결과에 대응하는 에러 코드 (REGISTERED 는 null)
     */
    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isSuccess() {
        return this == REGISTERED;
    }
}

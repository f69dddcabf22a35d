package personal.eventhub.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C003", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C004", "서버 내부 오류가 발생했습니다."),
    TRANSIENT_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "C005", "일시적인 오류가 발생했습니다. 잠시 후 다시 시도해주세요."),

    // User Domain (Uxxx)
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "사용자를 찾을 수 없습니다."),
    USER_ALREADY_EXISTS(HttpStatus.CONFLICT, "U002", "이미 존재하는 사용자입니다."),
    USER_HAS_REGISTRATIONS(HttpStatus.CONFLICT, "U003", "등록 내역이 있는 사용자는 삭제할 수 없습니다."),

    // Event Domain (Exxx)
    EVENT_NOT_FOUND(HttpStatus.NOT_FOUND, "E001", "이벤트를 찾을 수 없습니다."),
    EVENT_HAS_REGISTRATIONS(HttpStatus.CONFLICT, "E002", "등록자가 있는 이벤트는 삭제할 수 없습니다."),

    // Registration Domain (Rxxx)
    EVENT_FULL(HttpStatus.CONFLICT, "R001", "이벤트 정원이 모두 찼습니다."),
    ALREADY_REGISTERED(HttpStatus.CONFLICT, "R002", "이미 등록된 이벤트입니다."),
    REGISTRATION_NOT_FOUND(HttpStatus.NOT_FOUND, "R003", "등록 정보를 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

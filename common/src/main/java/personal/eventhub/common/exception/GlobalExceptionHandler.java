package personal.eventhub.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리 핸들러
 * 모든 실패 응답을 ErrorResponse 포맷으로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        private static final String DEFAULT_VALIDATION_MESSAGE = "입력값이 유효하지 않습니다.";

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                if (errorCode.getHttpStatus().is5xxServerError()) {
                        log.error("Business exception occurred: code={}, detail={}", errorCode.getCode(), e.getMessage());
                } else {
                        log.warn("Business exception occurred: code={}, detail={}", errorCode.getCode(), e.getMessage());
                }

                // INVALID_INPUT은 상세 사유를 그대로 노출
                String message = errorCode == ErrorCode.INVALID_INPUT ? e.getMessage() : errorCode.getMessage();
                return toResponse(errorCode, message);
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());
                return toResponse(ErrorCode.NOT_FOUND, "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = DEFAULT_VALIDATION_MESSAGE;
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                return toResponse(ErrorCode.INVALID_INPUT, message);
        }

        @ExceptionHandler(HandlerMethodValidationException.class)
        public ResponseEntity<ErrorResponse> handleHandlerMethodValidationException(HandlerMethodValidationException e) {
                log.warn("Parameter validation failed: {}", e.getMessage());
                String message = DEFAULT_VALIDATION_MESSAGE;
                if (!e.getAllErrors().isEmpty()) {
                        message = e.getAllErrors().get(0).getDefaultMessage();
                }
                return toResponse(ErrorCode.INVALID_INPUT, message);
        }

        @ExceptionHandler(ConstraintViolationException.class)
        public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
                log.warn("Constraint violation: {}", e.getMessage());
                return toResponse(ErrorCode.INVALID_INPUT, e.getMessage());
        }

        @ExceptionHandler(HttpMessageNotReadableException.class)
        public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
                log.warn("Malformed request body: {}", e.getMessage());
                return toResponse(ErrorCode.INVALID_INPUT, "요청 본문을 읽을 수 없습니다.");
        }

        @ExceptionHandler(MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException e) {
                log.warn("Type mismatch: name={}, value={}", e.getName(), e.getValue());
                return toResponse(ErrorCode.INVALID_INPUT, "잘못된 형식의 값입니다: " + e.getName());
        }

        @ExceptionHandler(MissingServletRequestParameterException.class)
        public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
                        MissingServletRequestParameterException e) {
                log.warn("Missing parameter: {}", e.getParameterName());
                return toResponse(ErrorCode.INVALID_INPUT, "필수 파라미터가 누락되었습니다: " + e.getParameterName());
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);
                return toResponse(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
        }

        private ResponseEntity<ErrorResponse> toResponse(ErrorCode errorCode, String message) {
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(ErrorResponse.of(errorCode, message));
        }
}

package personal.eventhub.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler 단위 테스트")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("비즈니스 예외는 ErrorCode의 상태와 코드로 변환된다")
    void businessException_MapsToErrorCode() {
        // given
        BusinessException e = new BusinessException(ErrorCode.EVENT_FULL, "Registration rejected: eventId=1");

        // when
        ResponseEntity<ErrorResponse> response = handler.handleBusinessException(e);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("R001");
        assertThat(response.getBody().message()).isEqualTo(ErrorCode.EVENT_FULL.getMessage());
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    @DisplayName("INVALID_INPUT은 상세 사유를 메시지로 노출한다")
    void invalidInput_ExposesDetail() {
        // given
        BusinessException e = new BusinessException(ErrorCode.INVALID_INPUT,
                "Event capacity cannot be changed after creation");

        // when
        ResponseEntity<ErrorResponse> response = handler.handleBusinessException(e);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("Event capacity cannot be changed after creation");
    }

    @Test
    @DisplayName("일시적 실패는 503으로 응답한다")
    void transientFailure_Returns503() {
        // when
        ResponseEntity<ErrorResponse> response =
                handler.handleBusinessException(new BusinessException(ErrorCode.TRANSIENT_FAILURE));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().code()).isEqualTo("C005");
    }

    @Test
    @DisplayName("예상하지 못한 예외는 내부 정보를 숨기고 500으로 응답한다")
    void unexpectedException_Returns500() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("db password leaked"));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().code()).isEqualTo("C004");
        assertThat(response.getBody().message()).doesNotContain("db password");
    }
}

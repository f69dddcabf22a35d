package personal.eventhub.core.registration.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.eventhub.common.dto.ApiResponse;
import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;
import personal.eventhub.core.registration.adapter.in.web.dto.RegistrationRequest;
import personal.eventhub.core.registration.adapter.in.web.dto.RegistrationResponse;
import personal.eventhub.core.registration.application.port.in.CancelRegistrationUseCase;
import personal.eventhub.core.registration.application.port.in.GetRegistrationUseCase;
import personal.eventhub.core.registration.application.port.in.RegisterUseCase;
import personal.eventhub.core.registration.domain.model.CancellationOutcome;
import personal.eventhub.core.registration.domain.model.RegistrationResult;

/**
 * Registration API Controller
 * 이벤트 등록/취소/조회 REST API
 *
 * 유스케이스 결과값을 HTTP 응답으로 매핑한다.
 * 거절 결과는 대응하는 ErrorCode 로 변환되어 GlobalExceptionHandler 가 응답을 만든다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/registrations")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegisterUseCase registerUseCase;
    private final CancelRegistrationUseCase cancelRegistrationUseCase;
    private final GetRegistrationUseCase getRegistrationUseCase;

    /**
     * 이벤트 등록
     * POST /api/v1/registrations
     */
    @PostMapping
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegistrationRequest request) {
        log.info("Register: userId={}, eventId={}", request.userId(), request.eventId());

        RegistrationResult result = registerUseCase.register(request.toRegisterCommand());

        if (!result.isRegistered()) {
            throw new BusinessException(result.outcome().errorCode(),
                    String.format("Registration rejected: userId=%d, eventId=%d, outcome=%s",
                            request.userId(), request.eventId(), result.outcome()));
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponse.from(result.registration()));
    }

    /**
     * 등록 취소 (멱등)
     * DELETE /api/v1/registrations
     */
    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> cancel(@Valid @RequestBody RegistrationRequest request) {
        log.info("Cancel registration: userId={}, eventId={}", request.userId(), request.eventId());

        CancellationOutcome outcome = cancelRegistrationUseCase.cancel(request.toCancelCommand());

        if (!outcome.isSuccess()) {
            throw new BusinessException(ErrorCode.TRANSIENT_FAILURE,
                    String.format("Cancellation failed: userId=%d, eventId=%d", request.userId(), request.eventId()));
        }

        String message = outcome == CancellationOutcome.CANCELLED
                ? "Registration cancelled successfully"
                : "No registration to cancel";
        return ResponseEntity.ok(ApiResponse.success(message));
    }

    /**
     * 등록 조회
     * GET /api/v1/registrations/{registrationId}
     */
    @GetMapping("/{registrationId}")
    public ResponseEntity<RegistrationResponse> getRegistration(@PathVariable Long registrationId) {
        log.info("Get registration: registrationId={}", registrationId);
        return ResponseEntity.ok(RegistrationResponse.from(getRegistrationUseCase.getRegistration(registrationId)));
    }
}

package personal.eventhub.core.registration.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.eventhub.core.registration.application.port.in.CancelRegistrationCommand;
import personal.eventhub.core.registration.application.port.in.RegisterCommand;

/**
 * 등록/취소 요청 DTO
 */
public record RegistrationRequest(
        @NotNull(message = "사용자 ID는 필수입니다.")
        Long userId,

        @NotNull(message = "이벤트 ID는 필수입니다.")
        Long eventId
) {
    public RegisterCommand toRegisterCommand() {
        return new RegisterCommand(userId, eventId);
    }

    public CancelRegistrationCommand toCancelCommand() {
        return new CancelRegistrationCommand(userId, eventId);
    }
}

package personal.eventhub.core.event.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.eventhub.core.event.application.port.in.UpdateEventCommand;

/**
 * 이벤트 수정 요청 DTO
 * capacity는 기존 값과 같을 때만 허용
 */
public record UpdateEventRequest(
        @NotBlank(message = "이벤트 제목은 필수입니다.")
        @Size(max = 255, message = "이벤트 제목은 255자 이하여야 합니다.")
        String title,

        Integer capacity
) {
    public UpdateEventCommand toCommand(Long eventId) {
        return new UpdateEventCommand(eventId, title, capacity);
    }
}

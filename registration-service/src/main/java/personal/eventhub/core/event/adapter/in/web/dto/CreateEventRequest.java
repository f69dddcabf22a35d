package personal.eventhub.core.event.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.eventhub.core.event.application.port.in.CreateEventCommand;

/**
 * 이벤트 생성 요청 DTO
 */
public record CreateEventRequest(
        @NotBlank(message = "이벤트 제목은 필수입니다.")
        @Size(max = 255, message = "이벤트 제목은 255자 이하여야 합니다.")
        String title,

        @NotNull(message = "정원은 필수입니다.")
        @Positive(message = "정원은 1 이상이어야 합니다.")
        Integer capacity,

        @NotNull(message = "개설자 ID는 필수입니다.")
        Long organizerId
) {
    public CreateEventCommand toCommand() {
        return new CreateEventCommand(title, capacity, organizerId);
    }
}

package personal.eventhub.core.registration.adapter.in.web.dto;

import personal.eventhub.core.registration.domain.model.Registration;

import java.time.LocalDateTime;

/**
 * 등록 조회/생성 응답 DTO
 */
public record RegistrationResponse(
        Long id,
        Long userId,
        Long eventId,
        LocalDateTime createdAt
) {
    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(
                registration.id(),
                registration.userId(),
                registration.eventId(),
                registration.createdAt()
        );
    }
}

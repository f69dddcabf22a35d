package personal.eventhub.core.registration.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;
import personal.eventhub.core.registration.domain.model.Registration;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

import java.time.LocalDateTime;

/**
 * Outbox Event Factory (Adapter Layer)
 * Registration을 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    private final ObjectMapper objectMapper;

    public OutboxEventEntity create(Registration registration, RegistrationEventType eventType) {
        Object event = switch (eventType) {
            case REGISTRATION_CREATED -> new RegistrationCreatedEvent(
                    registration.id(),
                    registration.userId(),
                    registration.eventId(),
                    registration.createdAt().toString());
            case REGISTRATION_CANCELLED -> new RegistrationCancelledEvent(
                    registration.id(),
                    registration.userId(),
                    registration.eventId(),
                    LocalDateTime.now().toString());
        };

        try {
            return OutboxEventEntity.pending(registration.id(), eventType, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: registrationId={}, type={}", registration.id(), eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record RegistrationCreatedEvent(
            Long registrationId,
            Long userId,
            Long eventId,
            String createdAt) {
    }

    public record RegistrationCancelledEvent(
            Long registrationId,
            Long userId,
            Long eventId,
            String cancelledAt) {
    }
}

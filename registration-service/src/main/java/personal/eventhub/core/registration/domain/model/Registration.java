package personal.eventhub.core.registration.domain.model;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Registration Domain Model
 * (user, event) 쌍에 대한 등록 (불변)
 */
public record Registration(
        Long id,
        Long userId,
        Long eventId,
        LocalDateTime createdAt
) {
    public Registration {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (eventId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event ID cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 등록 생성 (정적 팩토리 메서드)
     */
    public static Registration create(Long userId, Long eventId) {
        return new Registration(null, userId, eventId, LocalDateTime.now());
    }
}

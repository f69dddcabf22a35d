package personal.eventhub.core.user.adapter.in.web.dto;

import personal.eventhub.core.user.domain.model.User;
import personal.eventhub.core.user.domain.model.UserRole;

/**
 * 사용자 응답 DTO
 */
public record UserResponse(
        Long id,
        String name,
        String email,
        UserRole role
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.name(), user.email(), user.role());
    }
}

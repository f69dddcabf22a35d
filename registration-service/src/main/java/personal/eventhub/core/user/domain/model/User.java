package personal.eventhub.core.user.domain.model;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * User Domain Model
 * 사용자 도메인의 불변 모델
 */
public record User(
        Long id,
        String name,
        String email,
        UserRole role
) {
    public User {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
        if (role == null) {
            role = UserRole.ATTENDEE;
        }
    }

    /**
     * 신규 사용자 생성 (ID 미할당)
     */
    public static User create(String name, String email, UserRole role) {
        return new User(null, name, email, role);
    }

    /**
     * 프로필 변경
     * role이 null이면 기존 역할 유지
     */
    public User update(String newName, String newEmail, UserRole newRole) {
        return new User(id, newName, newEmail, newRole != null ? newRole : role);
    }

    public boolean isOrganizer() {
        return role == UserRole.ORGANIZER;
    }
}

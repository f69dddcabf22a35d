package personal.eventhub.core.user.domain.model;

/**
 * 사용자 역할
 */
public enum UserRole {
    ORGANIZER,  // 이벤트 개설자
    ATTENDEE    // 참가자
}

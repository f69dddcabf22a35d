package personal.eventhub.core.registration.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.eventhub.core.registration.domain.model.Registration;

import java.time.LocalDateTime;

/**
 * Registration JPA Entity
 * 등록 테이블 매핑
 */
@Entity
@Table(name = "registrations",
        uniqueConstraints = @UniqueConstraint(
                name = RegistrationEntity.UNIQUE_USER_EVENT,
                columnNames = {"user_id", "event_id"}
        ),
        indexes = {
                @Index(name = "idx_registration_event", columnList = "event_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RegistrationEntity {

    static final String UNIQUE_USER_EVENT = "uk_registration_user_event";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static RegistrationEntity fromDomain(Registration registration) {
        RegistrationEntity entity = new RegistrationEntity();
        entity.id = registration.id();
        entity.userId = registration.userId();
        entity.eventId = registration.eventId();
        entity.createdAt = registration.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Registration toDomain() {
        return new Registration(id, userId, eventId, createdAt);
    }
}

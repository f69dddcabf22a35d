package personal.eventhub.core.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.eventhub.core.user.domain.model.User;
import personal.eventhub.core.user.domain.model.UserRole;

import java.time.LocalDateTime;

/**
 * User JPA Entity
 * 사용자 테이블 매핑
 */
@Entity
@Table(name = "users",
        uniqueConstraints = @UniqueConstraint(name = UserEntity.UNIQUE_EMAIL, columnNames = "email"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    static final String UNIQUE_EMAIL = "uk_users_email";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 255)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static UserEntity fromDomain(User user) {
        UserEntity entity = new UserEntity();
        entity.id = user.id();
        entity.name = user.name();
        entity.email = user.email();
        entity.role = user.role();
        return entity;
    }

    /**
     * 영속 상태의 엔티티에 도메인 변경 사항 반영
     */
    public void apply(User user) {
        this.name = user.name();
        this.email = user.email();
        this.role = user.role();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * 도메인 모델로 변환
     */
    public User toDomain() {
        return new User(id, name, email, role);
    }
}

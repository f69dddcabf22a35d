package personal.eventhub.core.event.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;
import personal.eventhub.core.event.domain.model.Event;

import java.time.LocalDateTime;

/**
 * Event JPA Entity
 * 이벤트 테이블 매핑 (Seat Ledger 행)
 *
 * available_seats 범위는 CHECK 제약으로 DB에서도 보장
 */
@Entity
@Table(name = "events",
        indexes = {
                @Index(name = "idx_event_organizer", columnList = "organizer_id")
        })
@Check(name = "ck_events_available_seats",
        constraints = "capacity > 0 AND available_seats >= 0 AND available_seats <= capacity")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(nullable = false, updatable = false)
    private int capacity;

    // 엔티티 flush 로는 갱신하지 않는다. 변경은 JpaEventRepository 의 조건부 UPDATE(reserve/release)만 수행
    @Column(name = "available_seats", nullable = false, updatable = false)
    private int availableSeats;

    @Column(name = "organizer_id", nullable = false, updatable = false)
    private Long organizerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 신규 이벤트 엔티티 생성
     */
    public static EventEntity fromDomain(Event event) {
        EventEntity entity = new EventEntity();
        entity.id = event.id();
        entity.title = event.title();
        entity.capacity = event.capacity();
        entity.availableSeats = event.availableSeats();
        entity.organizerId = event.organizerId();
        return entity;
    }

    /**
     * 제목 변경 (영속성 컨텍스트 내에서 사용)
     * 좌석 컬럼은 SeatLedger 의 조건부 UPDATE 로만 변경
     */
    public void rename(String newTitle) {
        this.title = newTitle;
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
    public Event toDomain() {
        return new Event(id, title, capacity, availableSeats, organizerId);
    }
}

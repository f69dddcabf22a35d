package personal.eventhub.core.registration.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.eventhub.core.registration.domain.model.OutboxEvent;
import personal.eventhub.core.registration.domain.model.OutboxEvent.OutboxEventStatus;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

import java.time.LocalDateTime;

/**
 * 등록 변경과 같은 트랜잭션에 기록되는 Outbox 행
 * 릴레이는 (status, created_at) 인덱스로 PENDING 행을 생성 순서대로 읽는다.
 */
@Entity
@Table(name = "outbox_events",
        indexes = {
                @Index(name = "idx_outbox_status_created", columnList = "status, created_at"),
                @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    static final String REGISTRATION_AGGREGATE = "REGISTRATION";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    // Kafka 메시지 키로도 쓰인다
    @Column(name = "aggregate_id", nullable = false)
    private Long aggregateId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxEventStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    static OutboxEventEntity pending(Long registrationId, RegistrationEventType type, String payload) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.aggregateType = REGISTRATION_AGGREGATE;
        entity.aggregateId = registrationId;
        entity.eventType = type.name();
        entity.payload = payload;
        entity.status = OutboxEventStatus.PENDING;
        entity.createdAt = LocalDateTime.now();
        return entity;
    }

    /**
     * 릴레이 결과(발행 완료 또는 실패 누적)를 반영한다. 내용 컬럼은 불변이다.
     */
    void applyRelayState(OutboxEvent relayed) {
        this.status = relayed.status();
        this.retryCount = relayed.retryCount();
        this.publishedAt = relayed.publishedAt();
    }

    OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount);
    }
}

package personal.eventhub.core.registration.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 등록 트랜잭션과 함께 저장되고, 이후 Kafka 로 중계되는 이벤트 (불변)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount
) {
    public static final int MAX_RETRY_COUNT = 3;

    public OutboxEvent markAsPublished() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, LocalDateTime.now(), retryCount);
    }

    /**
     * 발행 실패 기록. 최대 재시도 횟수에 도달하면 FAILED 로 전환
     */
    public OutboxEvent recordFailure() {
        int nextRetryCount = retryCount + 1;
        OutboxEventStatus nextStatus = nextRetryCount >= MAX_RETRY_COUNT
                ? OutboxEventStatus.FAILED
                : OutboxEventStatus.PENDING;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                nextStatus, createdAt, publishedAt, nextRetryCount);
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 재시도 한도 초과
    }
}

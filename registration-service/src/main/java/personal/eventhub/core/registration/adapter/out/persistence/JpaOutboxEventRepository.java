package personal.eventhub.core.registration.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.eventhub.core.registration.domain.model.OutboxEvent;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * Aggregate ID로 이벤트 조회
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, Long aggregateId);

    /**
     * 발행 대기 중인 이벤트 조회 (재시도 횟수 제한, 배치 크기 100)
     */
    List<OutboxEventEntity> findTop100ByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
            OutboxEvent.OutboxEventStatus status,
            int maxRetryCount
    );
}

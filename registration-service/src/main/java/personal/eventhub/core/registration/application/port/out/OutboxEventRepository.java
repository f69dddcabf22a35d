package personal.eventhub.core.registration.application.port.out;

import personal.eventhub.core.registration.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 * Transactional Outbox Pattern을 위한 이벤트 저장소 인터페이스
 */
public interface OutboxEventRepository {

    /**
     * Outbox 이벤트 상태 저장
     */
    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 조회 (생성 순, 재시도 한도 미만)
     *
     * @return PENDING 상태의 이벤트 목록
     */
    List<OutboxEvent> findPendingEvents();
}

package personal.eventhub.core.event.application.port.out;

import personal.eventhub.core.event.domain.model.Event;

import java.util.Optional;

/**
 * Event Repository (Output Port)
 * 이벤트 메타데이터 저장소. 잔여 좌석 변경은 SeatLedger 담당
 */
public interface EventRepository {

    Optional<Event> findById(Long eventId);

    /**
     * 이벤트 저장
     * 신규 이벤트는 전체 저장, 기존 이벤트는 제목만 반영 (좌석 컬럼은 건드리지 않음)
     */
    Event save(Event event);

    void deleteById(Long eventId);
}

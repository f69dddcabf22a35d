package personal.eventhub.core.event.application.port.out;

import personal.eventhub.core.event.domain.model.Event;

import java.util.Optional;

/**
 * Seat Ledger (Output Port)
 * 이벤트별 잔여 좌석 카운터. available_seats 를 변경하는 유일한 경로
 *
 * 모든 메서드는 호출자의 트랜잭션 안에서 실행되어야 한다.
 */
public interface SeatLedger {

    /**
     * 이벤트 행에 배타 락 획득 (SELECT ... FOR UPDATE)
     * 락이 풀릴 때까지 블로킹되며, 같은 이벤트에 대한 예약 시도를 직렬화한다
     *
     * @param eventId 이벤트 ID
     * @return 락을 획득한 시점의 이벤트 (없으면 Optional.empty())
     */
    Optional<Event> lockForUpdate(Long eventId);

    /**
     * 조건부 차감: available_seats > 0 일 때만 1 감소
     * 조건 평가와 쓰기는 DB가 단일 UPDATE 문으로 수행한다
     *
     * @param eventId 이벤트 ID
     * @return 차감 성공 여부 (false = 잔여 좌석 소진)
     */
    boolean reserve(Long eventId);

    /**
     * 좌석 반환: available_seats 1 증가
     * 기존에 예약된 좌석에 대해서만 호출된다
     *
     * @param eventId 이벤트 ID
     */
    void release(Long eventId);
}

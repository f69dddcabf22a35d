package personal.eventhub.core.event.application.port.in;

import personal.eventhub.core.event.domain.model.Event;

/**
 * Manage Event UseCase (Input Port)
 * 이벤트 생성/수정/삭제 유스케이스
 */
public interface ManageEventUseCase {

    /**
     * 이벤트 생성
     * 잔여 좌석은 정원과 동일하게 시작
     *
     * @param command 생성 커맨드 (title, capacity, organizerId)
     * @return 생성된 이벤트
     * @throws personal.eventhub.core.user.domain.exception.UserNotFoundException 개설자가 존재하지 않을 때
     */
    Event createEvent(CreateEventCommand command);

    /**
     * 이벤트 제목 수정
     * 정원은 생성 이후 변경할 수 없다
     *
     * @param command 수정 커맨드
     * @return 수정된 이벤트
     * @throws personal.eventhub.core.event.domain.exception.EventNotFoundException 이벤트가 없을 때
     * @throws personal.eventhub.common.exception.BusinessException 정원 변경을 시도할 때 (INVALID_INPUT)
     */
    Event updateEvent(UpdateEventCommand command);

    /**
     * 이벤트 삭제
     * 이벤트 행을 잠근 뒤 등록 수를 확인하므로 진행 중인 등록과 경합하지 않는다
     *
     * @param eventId 이벤트 ID
     * @throws personal.eventhub.core.event.domain.exception.EventNotFoundException 이벤트가 없을 때
     * @throws personal.eventhub.core.event.domain.exception.EventHasRegistrationsException 등록자가 있을 때
     */
    void deleteEvent(Long eventId);
}

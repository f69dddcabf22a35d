package personal.eventhub.core.registration.application.port.in;

import personal.eventhub.core.registration.domain.model.CancellationOutcome;

/**
 * Cancel Registration UseCase (Input Port)
 * 등록 취소 유스케이스
 */
public interface CancelRegistrationUseCase {

    /**
     * 등록 취소
     * 등록 삭제와 좌석 반환을 같은 트랜잭션에서 수행
     * 등록이 없으면 아무것도 변경하지 않는다 (NOT_REGISTERED)
     *
     * @param command 취소 커맨드 (userId, eventId)
     * @return 취소 결과
     */
    CancellationOutcome cancel(CancelRegistrationCommand command);
}

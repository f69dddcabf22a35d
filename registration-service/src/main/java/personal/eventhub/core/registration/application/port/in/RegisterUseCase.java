package personal.eventhub.core.registration.application.port.in;

import personal.eventhub.core.registration.domain.model.RegistrationResult;

/**
 * Register UseCase (Input Port)
 * 이벤트 등록 유스케이스
 */
public interface RegisterUseCase {

    /**
     * 이벤트 등록
     * 이벤트 행 락 안에서 중복/잔여 좌석을 확인하고, 등록 저장과 좌석 차감을 하나의 트랜잭션으로 수행
     *
     * 비즈니스 실패(정원 초과, 중복 등록, 대상 없음)는 예외가 아닌 결과값으로 반환된다.
     * TRANSIENT_FAILURE 는 부분 반영 없이 롤백된 상태이므로 처음부터 재시도해도 안전하다.
     *
     * @param command 등록 커맨드 (userId, eventId)
     * @return 등록 결과 (REGISTERED 인 경우 등록 정보 포함)
     */
    RegistrationResult register(RegisterCommand command);
}

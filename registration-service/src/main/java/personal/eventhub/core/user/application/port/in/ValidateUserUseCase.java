package personal.eventhub.core.user.application.port.in;

import personal.eventhub.core.user.domain.model.User;

/**
 * Validate User UseCase (Input Port)
 * 다른 컨텍스트(이벤트, 등록)에서 사용하는 사용자 검증 유스케이스
 */
public interface ValidateUserUseCase {

    /**
     * 사용자 ID로 검증
     * @param userId 사용자 ID
     * @return 사용자 정보
     * @throws personal.eventhub.core.user.domain.exception.UserNotFoundException 사용자가 존재하지 않을 때
     */
    User validateUser(Long userId);

    /**
     * 사용자 존재 여부 확인 (예외 없이)
     * @param userId 사용자 ID
     * @return 존재 여부
     */
    boolean exists(Long userId);
}

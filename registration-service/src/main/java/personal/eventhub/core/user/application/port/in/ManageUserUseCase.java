package personal.eventhub.core.user.application.port.in;

import personal.eventhub.core.user.domain.model.User;

/**
 * Manage User UseCase (Input Port)
 * 사용자 생성/수정/삭제
 */
public interface ManageUserUseCase {

    /**
     * @throws personal.eventhub.core.user.domain.exception.UserAlreadyExistsException 이메일 중복 시
     */
    User createUser(CreateUserCommand command);

    /**
     * @throws personal.eventhub.core.user.domain.exception.UserNotFoundException 사용자가 없을 때
     * @throws personal.eventhub.core.user.domain.exception.UserAlreadyExistsException 다른 사용자가 같은 이메일을 사용 중일 때
     */
    User updateUser(UpdateUserCommand command);

    /**
     * 등록 내역이 남아있는 사용자는 삭제할 수 없다
     *
     * @throws personal.eventhub.core.user.domain.exception.UserNotFoundException 사용자가 없을 때
     * @throws personal.eventhub.core.user.domain.exception.UserHasRegistrationsException 등록 내역이 있을 때
     */
    void deleteUser(Long userId);
}

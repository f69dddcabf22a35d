package personal.eventhub.core.user.application.port.out;

import personal.eventhub.core.user.domain.model.User;

import java.util.Optional;

/**
 * User Repository (Output Port)
 * 사용자 저장소 인터페이스
 */
public interface UserRepository {

    /**
     * 사용자 ID로 조회
     * @param userId 사용자 ID
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findById(Long userId);

    /**
     * 이메일로 사용자 조회
     * @param email 이메일
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findByEmail(String email);

    boolean existsById(Long userId);

    boolean existsByEmail(String email);

    /**
     * 사용자 저장 (신규 생성 또는 수정)
     *
     * @throws personal.eventhub.core.user.domain.exception.UserAlreadyExistsException 이메일 유니크 제약 위반 시
     */
    User save(User user);

    void deleteById(Long userId);
}

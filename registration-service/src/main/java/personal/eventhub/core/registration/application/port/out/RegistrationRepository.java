package personal.eventhub.core.registration.application.port.out;

import personal.eventhub.core.registration.domain.model.Registration;

import java.util.Optional;

/**
 * Registration Repository (Output Port)
 * 등록 저장소 인터페이스
 */
public interface RegistrationRepository {

    boolean existsByUserIdAndEventId(Long userId, Long eventId);

    /**
     * 등록 저장 (즉시 flush)
     * 저장과 함께 REGISTRATION_CREATED 이벤트가 Outbox 에 기록된다
     *
     * @param registration 신규 등록
     * @return 저장된 등록 정보 (ID 포함)
     * @throws personal.eventhub.core.registration.domain.exception.DuplicateRegistrationException (user_id, event_id) 유니크 제약 위반 시
     */
    Registration insert(Registration registration);

    /**
     * (user, event) 등록 삭제
     * 삭제된 경우 REGISTRATION_CANCELLED 이벤트가 Outbox 에 기록된다
     *
     * @return 삭제된 등록 (없으면 Optional.empty())
     */
    Optional<Registration> deleteByUserIdAndEventId(Long userId, Long eventId);

    Optional<Registration> findById(Long registrationId);

    boolean existsByUserId(Long userId);

    long countByEventId(Long eventId);
}

package personal.eventhub.core.registration.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.eventhub.core.registration.application.port.out.RegistrationEventPort;
import personal.eventhub.core.registration.application.port.out.RegistrationRepository;
import personal.eventhub.core.registration.domain.exception.DuplicateRegistrationException;
import personal.eventhub.core.registration.domain.model.Registration;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

import java.util.Locale;
import java.util.Optional;

/**
 * Registration Persistence Adapter
 * JPA를 사용한 등록 저장소 구현체
 * Transactional Outbox Pattern: RegistrationEventPort에 이벤트 기록 위임
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationPersistenceAdapter implements RegistrationRepository {

    private final JpaRegistrationRepository jpaRegistrationRepository;
    private final RegistrationEventPort registrationEventPort;

    @Override
    public boolean existsByUserIdAndEventId(Long userId, Long eventId) {
        return jpaRegistrationRepository.existsByUserIdAndEventId(userId, eventId);
    }

    @Override
    public Registration insert(Registration registration) {
        log.debug("Inserting registration: userId={}, eventId={}", registration.userId(), registration.eventId());

        Registration saved;
        try {
            saved = jpaRegistrationRepository.saveAndFlush(RegistrationEntity.fromDomain(registration)).toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isUserEventConflict(e)) {
                throw new DuplicateRegistrationException(registration.userId(), registration.eventId(), e);
            }
            throw e;
        }

        registrationEventPort.publishRegistrationEvent(saved, RegistrationEventType.REGISTRATION_CREATED);
        return saved;
    }

    @Override
    public Optional<Registration> deleteByUserIdAndEventId(Long userId, Long eventId) {
        log.debug("Deleting registration: userId={}, eventId={}", userId, eventId);

        Optional<Registration> found = jpaRegistrationRepository.findByUserIdAndEventId(userId, eventId)
                .map(RegistrationEntity::toDomain);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        Registration registration = found.get();
        if (jpaRegistrationRepository.deleteByIdReturningCount(registration.id()) == 0) {
            return Optional.empty();
        }

        registrationEventPort.publishRegistrationEvent(registration, RegistrationEventType.REGISTRATION_CANCELLED);
        return found;
    }

    @Override
    public Optional<Registration> findById(Long registrationId) {
        log.debug("Finding registration: registrationId={}", registrationId);
        return jpaRegistrationRepository.findById(registrationId)
                .map(RegistrationEntity::toDomain);
    }

    @Override
    public boolean existsByUserId(Long userId) {
        return jpaRegistrationRepository.existsByUserId(userId);
    }

    @Override
    public long countByEventId(Long eventId) {
        return jpaRegistrationRepository.countByEventId(eventId);
    }

    /**
     * (user_id, event_id) 유니크 제약 위반 여부
     * DB 벤더마다 식별자 대소문자가 달라 소문자로 비교
     */
    private boolean isUserEventConflict(DataIntegrityViolationException e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        return message != null
                && message.toLowerCase(Locale.ROOT).contains(RegistrationEntity.UNIQUE_USER_EVENT);
    }
}

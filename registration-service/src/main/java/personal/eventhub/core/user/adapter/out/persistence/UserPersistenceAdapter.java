package personal.eventhub.core.user.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.eventhub.core.user.application.port.out.UserRepository;
import personal.eventhub.core.user.domain.exception.UserAlreadyExistsException;
import personal.eventhub.core.user.domain.exception.UserNotFoundException;
import personal.eventhub.core.user.domain.model.User;

import java.util.Locale;
import java.util.Optional;

/**
 * User Persistence Adapter
 * JPA를 사용한 사용자 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepository {

    private final JpaUserRepository jpaUserRepository;

    @Override
    public Optional<User> findById(Long userId) {
        log.debug("Finding user by id: {}", userId);
        return jpaUserRepository.findById(userId)
                .map(UserEntity::toDomain);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        log.debug("Finding user by email");
        return jpaUserRepository.findByEmail(email)
                .map(UserEntity::toDomain);
    }

    @Override
    public boolean existsById(Long userId) {
        log.debug("Checking if user exists: {}", userId);
        return jpaUserRepository.existsById(userId);
    }

    @Override
    public boolean existsByEmail(String email) {
        return jpaUserRepository.existsByEmail(email);
    }

    @Override
    public User save(User user) {
        log.debug("Saving user: userId={}", user.id());
        try {
            UserEntity entity;
            if (user.id() == null) {
                entity = UserEntity.fromDomain(user);
            } else {
                entity = jpaUserRepository.findById(user.id())
                        .orElseThrow(() -> new UserNotFoundException(user.id()));
                entity.apply(user);
            }
            return jpaUserRepository.saveAndFlush(entity).toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isEmailConflict(e)) {
                log.warn("Email unique constraint violated: userId={}", user.id());
                throw new UserAlreadyExistsException(user.email());
            }
            throw e;
        }
    }

    @Override
    public void deleteById(Long userId) {
        log.debug("Deleting user: userId={}", userId);
        jpaUserRepository.deleteById(userId);
    }

    private boolean isEmailConflict(DataIntegrityViolationException e) {
        String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(UserEntity.UNIQUE_EMAIL);
    }
}

package personal.eventhub.core.user.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.eventhub.core.user.application.port.in.CreateUserCommand;
import personal.eventhub.core.user.application.port.in.GetUserUseCase;
import personal.eventhub.core.user.application.port.in.ManageUserUseCase;
import personal.eventhub.core.user.application.port.in.UpdateUserCommand;
import personal.eventhub.core.user.application.port.in.ValidateUserUseCase;
import personal.eventhub.core.user.application.port.out.UserRegistrationPort;
import personal.eventhub.core.user.application.port.out.UserRepository;
import personal.eventhub.core.user.domain.exception.UserAlreadyExistsException;
import personal.eventhub.core.user.domain.exception.UserHasRegistrationsException;
import personal.eventhub.core.user.domain.exception.UserNotFoundException;
import personal.eventhub.core.user.domain.model.User;

/**
 * User Application Service
 * 사용자 관련 모든 UseCase를 구현하는 Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService implements ValidateUserUseCase, GetUserUseCase, ManageUserUseCase {

    private final UserRepository userRepository;
    private final UserRegistrationPort userRegistrationPort;

    @Override
    public User validateUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found for validation: userId={}", userId);
                    return new UserNotFoundException(userId);
                });
    }

    @Override
    public boolean exists(Long userId) {
        var exists = userRepository.existsById(userId);
        log.debug("User existence check: userId={}, exists={}", userId, exists);
        return exists;
    }

    @Override
    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found: userId={}", userId);
                    return new UserNotFoundException(userId);
                });
    }

    @Override
    public User getUserByEmail(String email) {
        return userRepository.findByEmail(email)
                .orElseThrow(() -> {
                    log.warn("User not found by email");
                    return new UserNotFoundException(email);
                });
    }

    @Override
    @Transactional
    public User createUser(CreateUserCommand command) {
        log.info("Creating user: role={}", command.role());

        if (userRepository.existsByEmail(command.email())) {
            log.warn("Duplicate email on user creation");
            throw new UserAlreadyExistsException(command.email());
        }

        // 동시 가입 경합은 users.email 유니크 제약이 최종 방어
        return userRepository.save(User.create(command.name(), command.email(), command.role()));
    }

    @Override
    @Transactional
    public User updateUser(UpdateUserCommand command) {
        log.info("Updating user: userId={}", command.userId());

        User user = getUser(command.userId());

        if (!user.email().equals(command.email()) && userRepository.existsByEmail(command.email())) {
            log.warn("Email already taken on user update: userId={}", command.userId());
            throw new UserAlreadyExistsException(command.email());
        }

        return userRepository.save(user.update(command.name(), command.email(), command.role()));
    }

    @Override
    @Transactional
    public void deleteUser(Long userId) {
        log.info("Deleting user: userId={}", userId);

        if (!userRepository.existsById(userId)) {
            log.warn("User not found for deletion: userId={}", userId);
            throw new UserNotFoundException(userId);
        }
        if (userRegistrationPort.hasRegistrations(userId)) {
            log.warn("User still holds registrations: userId={}", userId);
            throw new UserHasRegistrationsException(userId);
        }

        userRepository.deleteById(userId);
    }
}

package personal.eventhub.core.user.adapter.out.registration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.eventhub.core.registration.application.port.out.RegistrationRepository;
import personal.eventhub.core.user.application.port.out.UserRegistrationPort;

/**
 * User Registration Adapter
 * 사용자 삭제 가능 여부 확인을 위한 등록 조회 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserRegistrationAdapter implements UserRegistrationPort {

    private final RegistrationRepository registrationRepository;

    @Override
    public boolean hasRegistrations(Long userId) {
        boolean has = registrationRepository.existsByUserId(userId);
        log.debug("User registration check: userId={}, hasRegistrations={}", userId, has);
        return has;
    }
}

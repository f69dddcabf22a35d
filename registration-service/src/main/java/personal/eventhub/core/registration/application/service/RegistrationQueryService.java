package personal.eventhub.core.registration.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.eventhub.core.registration.application.port.in.GetRegistrationUseCase;
import personal.eventhub.core.registration.application.port.out.RegistrationRepository;
import personal.eventhub.core.registration.domain.exception.RegistrationNotFoundException;
import personal.eventhub.core.registration.domain.model.Registration;

/**
 * Registration Query Service
 * 등록 조회 전용 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RegistrationQueryService implements GetRegistrationUseCase {

    private final RegistrationRepository registrationRepository;

    @Override
    public Registration getRegistration(Long registrationId) {
        return registrationRepository.findById(registrationId)
                .orElseThrow(() -> {
                    log.warn("Registration not found: registrationId={}", registrationId);
                    return new RegistrationNotFoundException(registrationId);
                });
    }
}

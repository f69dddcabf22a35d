package personal.eventhub.core.registration.application.port.in;

import personal.eventhub.core.registration.domain.model.Registration;

/**
 * Get Registration UseCase (Input Port)
 */
public interface GetRegistrationUseCase {

    /**
     * @param registrationId 등록 ID
     * @return 등록 정보
     * @throws personal.eventhub.core.registration.domain.exception.RegistrationNotFoundException 등록이 없을 때
     */
    Registration getRegistration(Long registrationId);
}

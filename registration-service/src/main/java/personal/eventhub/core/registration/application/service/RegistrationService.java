package personal.eventhub.core.registration.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import personal.eventhub.core.registration.application.port.in.CancelRegistrationCommand;
import personal.eventhub.core.registration.application.port.in.CancelRegistrationUseCase;
import personal.eventhub.core.registration.application.port.in.RegisterCommand;
import personal.eventhub.core.registration.application.port.in.RegisterUseCase;
import personal.eventhub.core.registration.domain.model.CancellationOutcome;
import personal.eventhub.core.registration.domain.model.RegistrationOutcome;
import personal.eventhub.core.registration.domain.model.RegistrationResult;
import personal.eventhub.core.registration.domain.service.RegistrationManager;
import personal.eventhub.core.user.application.port.in.ValidateUserUseCase;

/**
 * Registration Coordinator (SRP)
 * 단일 책임: 등록/취소 요청을 받아 결과값으로 변환
 *
 * 사용자 검증은 트랜잭션 밖에서 수행한다. 검증 직후 사용자가 삭제되는 경합은 허용되며
 * 좌석 상태에는 영향을 주지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService implements RegisterUseCase, CancelRegistrationUseCase {

    private final ValidateUserUseCase validateUserUseCase;
    private final RegistrationManager registrationManager;

    @Override
    public RegistrationResult register(RegisterCommand command) {
        log.info("Registering: userId={}, eventId={}", command.userId(), command.eventId());

        try {
            if (!validateUserUseCase.exists(command.userId())) {
                log.warn("User not found for registration: userId={}", command.userId());
                return RegistrationResult.rejected(RegistrationOutcome.USER_NOT_FOUND);
            }

            RegistrationResult result = registrationManager.registerInTransaction(command);

            if (result.isRegistered()) {
                log.info("Registered: registrationId={}, userId={}, eventId={}",
                        result.registration().id(), command.userId(), command.eventId());
            }
            return result;

        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | TransactionException e) {
            log.warn("Transient failure on registration: userId={}, eventId={}, cause={}",
                    command.userId(), command.eventId(), e.getClass().getSimpleName(), e);
            return RegistrationResult.rejected(RegistrationOutcome.TRANSIENT_FAILURE);
        }
    }

    @Override
    public CancellationOutcome cancel(CancelRegistrationCommand command) {
        log.info("Cancelling registration: userId={}, eventId={}", command.userId(), command.eventId());

        try {
            CancellationOutcome outcome = registrationManager.cancelInTransaction(command);
            log.info("Cancellation finished: userId={}, eventId={}, outcome={}",
                    command.userId(), command.eventId(), outcome);
            return outcome;

        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | TransactionException e) {
            log.warn("Transient failure on cancellation: userId={}, eventId={}, cause={}",
                    command.userId(), command.eventId(), e.getClass().getSimpleName(), e);
            return CancellationOutcome.TRANSIENT_FAILURE;
        }
    }
}

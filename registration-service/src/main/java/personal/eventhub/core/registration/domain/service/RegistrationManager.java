package personal.eventhub.core.registration.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import personal.eventhub.core.event.application.port.out.SeatLedger;
import personal.eventhub.core.event.domain.model.Event;
import personal.eventhub.core.registration.application.port.in.CancelRegistrationCommand;
import personal.eventhub.core.registration.application.port.in.RegisterCommand;
import personal.eventhub.core.registration.application.port.out.RegistrationRepository;
import personal.eventhub.core.registration.domain.exception.DuplicateRegistrationException;
import personal.eventhub.core.registration.domain.model.CancellationOutcome;
import personal.eventhub.core.registration.domain.model.Registration;
import personal.eventhub.core.registration.domain.model.RegistrationOutcome;
import personal.eventhub.core.registration.domain.model.RegistrationResult;

import java.util.Optional;

/**
 * Registration Domain Service (Transaction Manager)
 * 좌석 예약 트랜잭션 프로토콜을 실행하는 전용 서비스
 *
 * 이벤트 행 배타 락(lockForUpdate)이 같은 이벤트에 대한 모든 등록/취소를 직렬화하고,
 * 조건부 차감(reserve)과 (user_id, event_id) 유니크 제약이 락과 무관하게 초과 등록을 막는다.
 * 거절되는 경로는 모두 롤백되므로 부분 반영 상태는 외부에 보이지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationManager {

    private final TransactionTemplate registrationTransactionTemplate;
    private final SeatLedger seatLedger;
    private final RegistrationRepository registrationRepository;

    /**
     * 트랜잭션 내에서 등록 처리
     * 커밋 실패, 락 타임아웃 등 인프라 예외는 그대로 전파된다
     */
    public RegistrationResult registerInTransaction(RegisterCommand command) {
        Long userId = command.userId();
        Long eventId = command.eventId();

        return registrationTransactionTemplate.execute(status -> {
            // 1. 중복 등록 확인
            if (registrationRepository.existsByUserIdAndEventId(userId, eventId)) {
                log.warn("Already registered: userId={}, eventId={}", userId, eventId);
                status.setRollbackOnly();
                return RegistrationResult.rejected(RegistrationOutcome.ALREADY_REGISTERED);
            }

            // 2. 이벤트 행 락 획득 (동일 이벤트 요청은 여기서 대기열을 이룸)
            Optional<Event> locked = seatLedger.lockForUpdate(eventId);
            if (locked.isEmpty()) {
                log.warn("Event not found: eventId={}", eventId);
                status.setRollbackOnly();
                return RegistrationResult.rejected(RegistrationOutcome.EVENT_NOT_FOUND);
            }

            // 3. 잔여 좌석 확인 (락 보유 상태이므로 최신 값)
            if (!locked.get().hasAvailableSeats()) {
                log.warn("Event full: userId={}, eventId={}", userId, eventId);
                status.setRollbackOnly();
                return RegistrationResult.rejected(RegistrationOutcome.EVENT_FULL);
            }

            // 4. 등록 저장 (유니크 제약 충돌 = 이미 등록, 좌석은 차감하지 않음)
            Registration saved;
            try {
                saved = registrationRepository.insert(Registration.create(userId, eventId));
            } catch (DuplicateRegistrationException e) {
                log.warn("Duplicate registration detected by unique constraint: userId={}, eventId={}",
                        userId, eventId);
                status.setRollbackOnly();
                return RegistrationResult.rejected(RegistrationOutcome.ALREADY_REGISTERED);
            }

            // 5. 조건부 좌석 차감
            if (!seatLedger.reserve(eventId)) {
                log.error("Seat ledger invariant violated: no seat to reserve under lock. eventId={}, availableSeats={}",
                        eventId, locked.get().availableSeats());
                status.setRollbackOnly();
                return RegistrationResult.rejected(RegistrationOutcome.EVENT_FULL);
            }

            log.debug("Seat reserved in transaction: registrationId={}, eventId={}", saved.id(), eventId);
            return RegistrationResult.registered(saved);
        });
    }

    /**
     * 트랜잭션 내에서 등록 취소 처리
     * 락 획득 순서는 등록과 동일 (이벤트 행 먼저)
     */
    public CancellationOutcome cancelInTransaction(CancelRegistrationCommand command) {
        Long userId = command.userId();
        Long eventId = command.eventId();

        return registrationTransactionTemplate.execute(status -> {
            if (seatLedger.lockForUpdate(eventId).isEmpty()) {
                log.debug("Cancel on missing event: userId={}, eventId={}", userId, eventId);
                return CancellationOutcome.NOT_REGISTERED;
            }

            Optional<Registration> removed = registrationRepository.deleteByUserIdAndEventId(userId, eventId);
            if (removed.isEmpty()) {
                log.debug("Nothing to cancel: userId={}, eventId={}", userId, eventId);
                return CancellationOutcome.NOT_REGISTERED;
            }

            // 실제로 삭제된 경우에만 좌석 반환
            seatLedger.release(eventId);

            log.debug("Seat released in transaction: registrationId={}, eventId={}", removed.get().id(), eventId);
            return CancellationOutcome.CANCELLED;
        });
    }
}

package personal.eventhub.core.registration.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
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

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * RegistrationManager 단위 테스트
 * TransactionTemplate은 Mock 트랜잭션 매니저로 구동하고, 롤백 표시 여부를 상태 객체로 검증한다
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RegistrationManager 단위 테스트")
class RegistrationManagerTest {

    private static final Long USER_ID = 1L;
    private static final Long EVENT_ID = 10L;

    @Mock
    private PlatformTransactionManager transactionManager;
    @Mock
    private SeatLedger seatLedger;
    @Mock
    private RegistrationRepository registrationRepository;

    private SimpleTransactionStatus transactionStatus;
    private RegistrationManager registrationManager;

    @BeforeEach
    void setUp() {
        transactionStatus = new SimpleTransactionStatus();
        given(transactionManager.getTransaction(any())).willReturn(transactionStatus);
        registrationManager = new RegistrationManager(
                new TransactionTemplate(transactionManager), seatLedger, registrationRepository);
    }

    private Event eventWithSeats(int availableSeats) {
        return new Event(EVENT_ID, "Meetup", 10, availableSeats, 99L);
    }

    @Test
    @DisplayName("등록 성공 - 등록 저장 후 좌석을 차감한다")
    void register_Success() {
        // given
        Registration saved = new Registration(100L, USER_ID, EVENT_ID, LocalDateTime.now());
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(false);
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(3)));
        given(registrationRepository.insert(any(Registration.class))).willReturn(saved);
        given(seatLedger.reserve(EVENT_ID)).willReturn(true);

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.REGISTERED);
        assertThat(result.registration().id()).isEqualTo(100L);
        assertThat(transactionStatus.isRollbackOnly()).isFalse();

        InOrder inOrder = inOrder(seatLedger, registrationRepository);
        inOrder.verify(seatLedger).lockForUpdate(EVENT_ID);
        inOrder.verify(registrationRepository).insert(any(Registration.class));
        inOrder.verify(seatLedger).reserve(EVENT_ID);
        verify(transactionManager).commit(transactionStatus);
    }

    @Test
    @DisplayName("이미 등록된 사용자 - 락을 잡지 않고 ALREADY_REGISTERED")
    void register_AlreadyRegistered() {
        // given
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(true);

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.ALREADY_REGISTERED);
        assertThat(result.registration()).isNull();
        assertThat(transactionStatus.isRollbackOnly()).isTrue();
        verify(seatLedger, never()).lockForUpdate(any());
        verify(seatLedger, never()).reserve(any());
    }

    @Test
    @DisplayName("이벤트 없음 - EVENT_NOT_FOUND")
    void register_EventNotFound() {
        // given
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(false);
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.empty());

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.EVENT_NOT_FOUND);
        assertThat(transactionStatus.isRollbackOnly()).isTrue();
        verify(registrationRepository, never()).insert(any());
    }

    @Test
    @DisplayName("만석 - 등록을 저장하지 않고 EVENT_FULL")
    void register_EventFull() {
        // given
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(false);
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(0)));

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.EVENT_FULL);
        assertThat(transactionStatus.isRollbackOnly()).isTrue();
        verify(registrationRepository, never()).insert(any());
        verify(seatLedger, never()).reserve(any());
    }

    @Test
    @DisplayName("유니크 제약 충돌 - 좌석을 차감하지 않고 ALREADY_REGISTERED")
    void register_UniqueConstraintConflict() {
        // given
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(false);
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(3)));
        given(registrationRepository.insert(any(Registration.class)))
                .willThrow(new DuplicateRegistrationException(USER_ID, EVENT_ID, new RuntimeException("uk violation")));

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.ALREADY_REGISTERED);
        assertThat(transactionStatus.isRollbackOnly()).isTrue();
        verify(seatLedger, never()).reserve(any());
    }

    @Test
    @DisplayName("조건부 차감 실패 - 등록 저장분까지 롤백 표시하고 EVENT_FULL")
    void register_ConditionalDecrementRejected() {
        // given
        given(registrationRepository.existsByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(false);
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(1)));
        given(registrationRepository.insert(any(Registration.class)))
                .willReturn(new Registration(100L, USER_ID, EVENT_ID, LocalDateTime.now()));
        given(seatLedger.reserve(EVENT_ID)).willReturn(false);

        // when
        RegistrationResult result = registrationManager.registerInTransaction(new RegisterCommand(USER_ID, EVENT_ID));

        // then
        assertThat(result.outcome()).isEqualTo(RegistrationOutcome.EVENT_FULL);
        assertThat(transactionStatus.isRollbackOnly()).isTrue();
    }

    @Test
    @DisplayName("취소 성공 - 삭제된 경우에만 좌석을 반환한다")
    void cancel_Success() {
        // given
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(0)));
        given(registrationRepository.deleteByUserIdAndEventId(USER_ID, EVENT_ID))
                .willReturn(Optional.of(new Registration(100L, USER_ID, EVENT_ID, LocalDateTime.now())));

        // when
        CancellationOutcome outcome = registrationManager.cancelInTransaction(
                new CancelRegistrationCommand(USER_ID, EVENT_ID));

        // then
        assertThat(outcome).isEqualTo(CancellationOutcome.CANCELLED);
        InOrder inOrder = inOrder(seatLedger, registrationRepository);
        inOrder.verify(seatLedger).lockForUpdate(EVENT_ID);
        inOrder.verify(registrationRepository).deleteByUserIdAndEventId(USER_ID, EVENT_ID);
        inOrder.verify(seatLedger).release(EVENT_ID);
    }

    @Test
    @DisplayName("등록되지 않은 취소 - 좌석을 반환하지 않는다")
    void cancel_NotRegistered() {
        // given
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.of(eventWithSeats(5)));
        given(registrationRepository.deleteByUserIdAndEventId(USER_ID, EVENT_ID)).willReturn(Optional.empty());

        // when
        CancellationOutcome outcome = registrationManager.cancelInTransaction(
                new CancelRegistrationCommand(USER_ID, EVENT_ID));

        // then
        assertThat(outcome).isEqualTo(CancellationOutcome.NOT_REGISTERED);
        verify(seatLedger, never()).release(any());
    }

    @Test
    @DisplayName("없는 이벤트 취소 - NOT_REGISTERED")
    void cancel_EventMissing() {
        // given
        given(seatLedger.lockForUpdate(EVENT_ID)).willReturn(Optional.empty());

        // when
        CancellationOutcome outcome = registrationManager.cancelInTransaction(
                new CancelRegistrationCommand(USER_ID, EVENT_ID));

        // then
        assertThat(outcome).isEqualTo(CancellationOutcome.NOT_REGISTERED);
        verify(registrationRepository, never()).deleteByUserIdAndEventId(any(), any());
        verify(seatLedger, never()).release(any());
    }
}

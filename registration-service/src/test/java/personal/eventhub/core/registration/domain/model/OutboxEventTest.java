package personal.eventhub.core.registration.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.eventhub.core.registration.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("등록 결과/Outbox 도메인 모델 테스트")
class OutboxEventTest {

    private OutboxEvent pending(int retryCount) {
        return new OutboxEvent(1L, "REGISTRATION", 100L, "REGISTRATION_CREATED", "{}",
                OutboxEventStatus.PENDING, LocalDateTime.now(), null, retryCount);
    }

    @Test
    @DisplayName("발행 실패가 한도에 도달하면 FAILED로 전환된다")
    void recordFailure_TransitionsToFailedAtLimit() {
        OutboxEvent once = pending(0).recordFailure();
        assertThat(once.status()).isEqualTo(OutboxEventStatus.PENDING);
        assertThat(once.retryCount()).isEqualTo(1);

        OutboxEvent exhausted = pending(OutboxEvent.MAX_RETRY_COUNT - 1).recordFailure();
        assertThat(exhausted.status()).isEqualTo(OutboxEventStatus.FAILED);
        assertThat(exhausted.retryCount()).isEqualTo(OutboxEvent.MAX_RETRY_COUNT);
    }

    @Test
    @DisplayName("발행 완료 시 발행 시각이 기록된다")
    void markAsPublished() {
        OutboxEvent published = pending(1).markAsPublished();

        assertThat(published.status()).isEqualTo(OutboxEventStatus.PUBLISHED);
        assertThat(published.publishedAt()).isNotNull();
        assertThat(published.retryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("등록 정보는 REGISTERED 결과에만 존재한다")
    void registrationResultConsistency() {
        Registration registration = Registration.create(1L, 10L);

        assertThat(RegistrationResult.registered(registration).isRegistered()).isTrue();
        assertThat(RegistrationResult.rejected(RegistrationOutcome.EVENT_FULL).registration()).isNull();
        assertThatThrownBy(() -> new RegistrationResult(RegistrationOutcome.EVENT_FULL, registration))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RegistrationResult.rejected(RegistrationOutcome.REGISTERED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("거절 결과는 대응하는 에러 코드를 가진다")
    void rejectedOutcomesCarryErrorCode() {
        for (RegistrationOutcome outcome : RegistrationOutcome.values()) {
            if (outcome.isSuccess()) {
                assertThat(outcome.errorCode()).isNull();
            } else {
                assertThat(outcome.errorCode()).as(outcome.name()).isNotNull();
            }
        }
    }
}

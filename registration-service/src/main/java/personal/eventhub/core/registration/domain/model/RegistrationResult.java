package personal.eventhub.core.registration.domain.model;

/**
 * Registration Result
 * 등록 결과와, 성공 시 생성된 등록 정보
 */
public record RegistrationResult(
        RegistrationOutcome outcome,
        Registration registration
) {
    public RegistrationResult {
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        if (outcome.isSuccess() != (registration != null)) {
            throw new IllegalArgumentException(
                    "Registration must be present only for REGISTERED outcome: " + outcome);
        }
    }

    public static RegistrationResult registered(Registration registration) {
        return new RegistrationResult(RegistrationOutcome.REGISTERED, registration);
    }

    public static RegistrationResult rejected(RegistrationOutcome outcome) {
        return new RegistrationResult(outcome, null);
    }

    public boolean isRegistered() {
        return outcome.isSuccess();
    }
}

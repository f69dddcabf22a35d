package personal.eventhub.core.registration.domain.model;

/**
 * 등록 취소 결과
 * NOT_REGISTERED 도 성공으로 취급한다 (멱등)
 */
public enum CancellationOutcome {
    CANCELLED,
    NOT_REGISTERED,
    TRANSIENT_FAILURE;

    public boolean isSuccess() {
        return this != TRANSIENT_FAILURE;
    }
}

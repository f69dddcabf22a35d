package personal.eventhub.core.registration.domain.model;

/**
 * 등록 도메인 이벤트 종류와 발행 토픽
 */
public enum RegistrationEventType {
    REGISTRATION_CREATED("registration.created"),
    REGISTRATION_CANCELLED("registration.cancelled");

    private final String topic;

    RegistrationEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}

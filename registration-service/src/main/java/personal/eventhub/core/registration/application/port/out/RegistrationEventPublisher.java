package personal.eventhub.core.registration.application.port.out;

/**
 * Registration Event Publisher (Output Port)
 * 메시지 브로커로의 이벤트 발행 인터페이스
 */
public interface RegistrationEventPublisher {

    /**
     * 이미 직렬화된 JSON Payload를 그대로 발행
     * 브로커 응답을 기다리며, 실패 시 예외를 던진다
     *
     * @param topic   발행할 토픽
     * @param key     메시지 키 (순서 보장용, registrationId)
     * @param payload 메시지 본문 (JSON String)
     * @throws personal.eventhub.core.registration.domain.exception.EventPublishFailedException 발행 실패 시
     */
    void publishRaw(String topic, String key, String payload);
}

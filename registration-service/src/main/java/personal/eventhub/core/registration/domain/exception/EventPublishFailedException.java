package personal.eventhub.core.registration.domain.exception;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Kafka 이벤트 발행 실패
 */
public class EventPublishFailedException extends BusinessException {

    public EventPublishFailedException(String topic, String key, Throwable cause) {
        super(ErrorCode.INTERNAL_SERVER_ERROR,
                String.format("Failed to publish event: topic=%s, key=%s", topic, key), cause);
    }
}

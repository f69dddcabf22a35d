package personal.eventhub.core.registration.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.eventhub.core.registration.application.port.out.RegistrationEventPublisher;
import personal.eventhub.core.registration.domain.exception.EventPublishFailedException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registration Kafka Publisher (Adapter Layer)
 * Kafka를 통한 등록 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 브로커 ack 까지 대기하여 실패를 재시도 로직에 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationKafkaPublisher implements RegistrationEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            var result = kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}, offset={}",
                    topic, key, result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishFailedException(topic, key, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EventPublishFailedException(topic, key, e);
        }
    }
}

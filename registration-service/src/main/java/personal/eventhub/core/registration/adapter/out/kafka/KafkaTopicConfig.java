package personal.eventhub.core.registration.adapter.out.kafka;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import personal.eventhub.core.registration.domain.model.RegistrationEventType;

/**
 * Kafka Topic 설정
 * KafkaAdmin 이 기동 시 토픽을 생성한다 (spring.kafka.admin.auto-create)
 */
@Configuration
public class KafkaTopicConfig {

    private static final int PARTITIONS = 3;

    @Bean
    public NewTopic registrationCreatedTopic() {
        return TopicBuilder.name(RegistrationEventType.REGISTRATION_CREATED.topic())
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic registrationCancelledTopic() {
        return TopicBuilder.name(RegistrationEventType.REGISTRATION_CANCELLED.topic())
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }
}

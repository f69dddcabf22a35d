package personal.eventhub.core.registration.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Registration 설정 Properties
 * application.yml의 registration.* 설정을 바인딩
 *
 * @param transactionTimeoutSeconds 등록/취소 트랜잭션 타임아웃 (락 대기 포함)
 */
@ConfigurationProperties(prefix = "registration")
public record RegistrationProperties(
        @DefaultValue("5") int transactionTimeoutSeconds
) {
}

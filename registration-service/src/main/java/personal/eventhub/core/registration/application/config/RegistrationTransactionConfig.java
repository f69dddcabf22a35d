package personal.eventhub.core.registration.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 등록 트랜잭션 설정
 * 락 대기가 무한정 길어지지 않도록 타임아웃이 걸린 TransactionTemplate 을 제공
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RegistrationProperties.class)
public class RegistrationTransactionConfig {

    @Bean
    public TransactionTemplate registrationTransactionTemplate(PlatformTransactionManager transactionManager,
                                                               RegistrationProperties properties) {
        log.info("Registration transaction timeout: {}s", properties.transactionTimeoutSeconds());
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(properties.transactionTimeoutSeconds());
        return template;
    }
}

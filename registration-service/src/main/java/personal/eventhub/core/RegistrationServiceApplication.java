package personal.eventhub.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Registration Service Application
 * User, Event(Seat Ledger), Registration 도메인을 포함하는 핵심 비즈니스 서비스
 */
@EnableScheduling  // Outbox Scheduler 활성화
@SpringBootApplication(
    scanBasePackages = {
        "personal.eventhub.core",
        "personal.eventhub.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class RegistrationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RegistrationServiceApplication.class, args);
    }
}

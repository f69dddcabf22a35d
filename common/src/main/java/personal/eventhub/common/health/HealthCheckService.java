package personal.eventhub.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Health Check 공통 유틸리티 서비스
 * 각 인프라 컴포넌트의 상태를 확인하는 재사용 가능한 메서드 제공
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final int KAFKA_TIMEOUT_SECONDS = 3;

    private final KafkaAdmin kafkaAdmin;

    /**
     * Kafka 연결 상태 확인
     *
     * @return "UP" if Kafka cluster is reachable, "DOWN" otherwise
     */
    public String checkKafka() {
        Map<String, Object> config = new HashMap<>(kafkaAdmin.getConfigurationProperties());
        config.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) TimeUnit.SECONDS.toMillis(KAFKA_TIMEOUT_SECONDS));
        config.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) TimeUnit.SECONDS.toMillis(KAFKA_TIMEOUT_SECONDS));

        try (AdminClient adminClient = AdminClient.create(config)) {
            var nodes = adminClient.describeCluster().nodes().get(KAFKA_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return (nodes != null && !nodes.isEmpty()) ? "UP" : "DOWN";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Kafka health check interrupted", e);
            return "DOWN";
        } catch (Exception e) {
            log.error("Kafka health check failed", e);
            return "DOWN";
        }
    }

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource the DataSource to check
     * @return "UP" if database is reachable, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return "DOWN";
        }
    }
}

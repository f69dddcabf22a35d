package personal.eventhub.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.eventhub.common.dto.ApiResponse;
import personal.eventhub.common.dto.HealthCheckResponse;
import personal.eventhub.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 애플리케이션 및 인프라 상태를 확인하는 엔드포인트를 제공합니다.
 * <p>
 * 일부 컴포넌트가 DOWN 이어도 HTTP 200 과 함께 result="error" 로 응답한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    /**
     * Health Check 엔드포인트
     * 데이터베이스, Kafka의 연결 상태를 확인합니다.
     *
     * @return ApiResponse with health check data
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = new HealthCheckResponse(
                healthCheckService.checkDatabase(dataSource),
                healthCheckService.checkKafka()
        );

        if (data.allUp()) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        log.warn("Unhealthy components detected: database={}, kafka={}", data.database(), data.kafka());
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}

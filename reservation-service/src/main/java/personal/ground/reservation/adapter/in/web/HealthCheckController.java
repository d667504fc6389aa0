package personal.ground.reservation.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ground.common.health.HealthCheckService;
import personal.ground.common.web.ApiResponse;
import personal.ground.reservation.adapter.in.web.dto.HealthCheckResponse;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.application.port.out.CourtLockPort;

/**
 * Health Check API Controller
 * Redis는 redis 락 전략에서만 확인하고, 외부 연동은 설정 여부만 표시
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final HealthCheckService healthCheckService;
    private final CourtLockPort courtLockPort;
    private final ExternalApiProperties externalApiProperties;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String lockStrategy = courtLockPort.getStrategyName();
        String redisStatus = "redis".equals(lockStrategy) ? healthCheckService.checkRedis() : "NOT_USED";

        ExternalApiProperties.Google google = externalApiProperties.google();
        HealthCheckResponse data = new HealthCheckResponse(
                lockStrategy,
                redisStatus,
                healthCheckService.checkConfigured(google.calendarId()),
                healthCheckService.checkConfigured(google.spreadsheetId()),
                externalApiProperties.discord().isActive() ? "CONFIGURED" : "DISABLED",
                healthCheckService.checkConfigured(externalApiProperties.anthropic().apiKey())
        );

        if ("DOWN".equals(redisStatus)) {
            return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
        }
        return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
    }
}

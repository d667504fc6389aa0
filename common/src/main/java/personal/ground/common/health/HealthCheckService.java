package personal.ground.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Health Check 공통 유틸리티 서비스
 * 인프라 컴포넌트의 상태를 확인하는 재사용 가능한 메서드 제공
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final StringRedisTemplate redisTemplate;

    /**
     * Redis 연결 상태 확인
     * 분산 락 전략(redis)에서만 의미가 있음
     *
     * @return "UP" if Redis is reachable, "DOWN" otherwise
     */
    public String checkRedis() {
        try {
            String response = redisTemplate.execute((RedisConnection connection) -> connection.ping());
            return "PONG".equals(response) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            return "DOWN";
        }
    }

    /**
     * 설정값 존재 여부로 외부 연동 상태 표시
     *
     * @return "CONFIGURED" or "DISABLED"
     */
    public String checkConfigured(String value) {
        return value == null || value.isBlank() ? "DISABLED" : "CONFIGURED";
    }
}

package personal.ground.reservation.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.ground.reservation.application.port.out.CourtLockPort;

import java.time.Duration;

/**
 * Court Lock Adapter Factory
 * 설정값에 따라 CourtLockPort 구현체를 생성
 *
 * - reservation.lock.strategy=none → NoCourtLockAdapter
 * - reservation.lock.strategy=local → LocalCourtLockAdapter (기본값)
 * - reservation.lock.strategy=redis → RedisCourtLockAdapter
 */
@Slf4j
@Configuration
public class CourtLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "reservation.lock.strategy", havingValue = "none")
    public CourtLockPort noCourtLockAdapter() {
        log.warn("Creating NoCourtLockAdapter - concurrent requests may double-book a court");
        return new NoCourtLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "reservation.lock.strategy", havingValue = "local", matchIfMissing = true)
    public CourtLockPort localCourtLockAdapter(CourtLockProperties properties) {
        log.info("Creating LocalCourtLockAdapter - wait timeout: {}ms", properties.getWaitTimeoutMs());
        return new LocalCourtLockAdapter(Duration.ofMillis(properties.getWaitTimeoutMs()));
    }

    @Bean
    @ConditionalOnProperty(name = "reservation.lock.strategy", havingValue = "redis")
    public CourtLockPort redisCourtLockAdapter(StringRedisTemplate redisTemplate, CourtLockProperties properties) {
        log.info("Creating RedisCourtLockAdapter - TTL: {}s, wait timeout: {}ms",
                properties.getTtlSeconds(), properties.getWaitTimeoutMs());
        return new RedisCourtLockAdapter(
                redisTemplate,
                Duration.ofSeconds(properties.getTtlSeconds()),
                Duration.ofMillis(properties.getWaitTimeoutMs()));
    }
}

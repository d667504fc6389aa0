package personal.ground.reservation.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.ground.reservation.application.port.out.CourtLockPort;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis Court Lock Adapter
 * 다중 인스턴스 환경에서 면/날짜별 분산 락을 사용하는 어댑터
 *
 * 특징:
 * - SET NX + TTL 로 획득, 대기 시간까지 짧은 간격으로 재시도
 * - 요청마다 고유 토큰을 발급하여 본인 소유 락만 해제 (Lua Script)
 * - Redis 장애 시 락 미획득으로 처리 (예약을 진행하지 않음)
 */
@Slf4j
public class RedisCourtLockAdapter implements CourtLockPort {

    private static final long RETRY_INTERVAL_MS = 50;

    // 락 해제 Lua Script (본인 소유인 경우만 삭제)
    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;
    private final Duration waitTimeout;

    public RedisCourtLockAdapter(StringRedisTemplate redisTemplate, Duration lockTtl, Duration waitTimeout) {
        this.redisTemplate = redisTemplate;
        this.lockTtl = lockTtl;
        this.waitTimeout = waitTimeout;
    }

    @Override
    public Optional<String> acquire(String courtId, LocalDate date) {
        String lockKey = buildLockKey(courtId, date);
        String token = UUID.randomUUID().toString();
        long deadline = System.currentTimeMillis() + waitTimeout.toMillis();

        try {
            do {
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, token, lockTtl);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("[RedisLock] Lock acquired: key={}", lockKey);
                    return Optional.of(token);
                }
                Thread.sleep(RETRY_INTERVAL_MS);
            } while (System.currentTimeMillis() < deadline);

            log.warn("[RedisLock] Lock wait timed out: key={}, waitMs={}", lockKey, waitTimeout.toMillis());
            return Optional.empty();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisLock] Interrupted while waiting for lock: key={}", lockKey);
            return Optional.empty();
        } catch (Exception e) {
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            return Optional.empty();
        }
    }

    @Override
    public void release(String courtId, LocalDate date, String ownerToken) {
        String lockKey = buildLockKey(courtId, date);

        try {
            Long released = redisTemplate.execute(
                    new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                    List.of(lockKey),
                    ownerToken);

            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}", lockKey);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // TTL 만료로 자동 해제됨
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    /**
     * Hash Tag {courtId}로 같은 면의 락이 같은 노드에 저장되도록 함
     */
    private String buildLockKey(String courtId, LocalDate date) {
        return String.format("reservation:lock:{%s}:%s", courtId, date);
    }
}

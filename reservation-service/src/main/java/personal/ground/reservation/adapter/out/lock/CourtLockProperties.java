package personal.ground.reservation.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Court Lock 설정 Properties
 *
 * 설정 예시:
 * reservation:
 *   lock:
 *     strategy: local       # none | local | redis
 *     ttl-seconds: 30       # redis 락 TTL (초)
 *     wait-timeout-ms: 3000 # 락 대기 시간
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reservation.lock")
public class CourtLockProperties {

    /**
     * 락 전략
     * - none: 락 사용 안 함 (경쟁 구간 재현용)
     * - local: JVM 내 면/날짜별 락 (단일 인스턴스)
     * - redis: Redis 분산 락 (다중 인스턴스)
     */
    private String strategy = "local";

    /**
     * redis 락 TTL (초). 캘린더 기록 최대 소요 시간보다 길어야 함
     */
    private int ttlSeconds = 30;

    /**
     * 락 획득 대기 시간 (밀리초)
     */
    private long waitTimeoutMs = 3000;
}

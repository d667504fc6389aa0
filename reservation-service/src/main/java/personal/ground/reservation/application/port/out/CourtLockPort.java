package personal.ground.reservation.application.port.out;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 면(court)별 락 Port
 * 중복 확인 ~ 캘린더 기록 구간을 직렬화하여 TOCTOU 경쟁을 막는다
 *
 * 구현체:
 * - NoCourtLockAdapter: 락 없음 (경쟁 구간 재현용)
 * - LocalCourtLockAdapter: 단일 인스턴스용 JVM 내 락
 * - RedisCourtLockAdapter: 다중 인스턴스용 Redis 분산 락
 */
public interface CourtLockPort {

    /**
     * 락 획득 시도 (설정된 대기 시간까지 대기)
     *
     * @return 소유자 토큰. 대기 시간 내 획득 실패 시 empty
     */
    Optional<String> acquire(String courtId, LocalDate date);

    /**
     * 락 해제 (소유자 토큰이 일치할 때만)
     */
    void release(String courtId, LocalDate date, String ownerToken);

    /**
     * 전략 이름 반환 (로깅/모니터링용)
     */
    String getStrategyName();
}

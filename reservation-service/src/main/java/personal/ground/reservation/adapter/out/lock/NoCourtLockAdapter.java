package personal.ground.reservation.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.ground.reservation.application.port.out.CourtLockPort;

import java.time.LocalDate;
import java.util.Optional;

/**
 * NoLock Adapter
 * 락을 사용하지 않는 어댑터
 *
 * 주의: 동시 요청 시 중복 확인과 캘린더 기록 사이의 경쟁으로 이중 예약이 가능함
 */
@Slf4j
public class NoCourtLockAdapter implements CourtLockPort {

    private static final String NO_LOCK_TOKEN = "none";

    @Override
    public Optional<String> acquire(String courtId, LocalDate date) {
        log.debug("[NoLock] Always allow: court={}, date={}", courtId, date);
        return Optional.of(NO_LOCK_TOKEN);
    }

    @Override
    public void release(String courtId, LocalDate date, String ownerToken) {
        // No-op
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}

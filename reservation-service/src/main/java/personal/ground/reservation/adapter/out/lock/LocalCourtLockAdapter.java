package personal.ground.reservation.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.ground.reservation.application.port.out.CourtLockPort;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Court Lock Adapter
 * 단일 인스턴스 환경에서 면/날짜별 JVM 내 락을 사용하는 어댑터
 *
 * 락은 획득한 스레드에서 해제해야 한다 (ReentrantLock 소유권)
 * 보유자/대기자가 없어진 항목은 맵에서 제거한다. 참조 수는 compute 안에서만 변경한다
 */
@Slf4j
public class LocalCourtLockAdapter implements CourtLockPort {

    private final Map<String, CourtLock> locks = new ConcurrentHashMap<>();
    private final Map<String, String> owners = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public LocalCourtLockAdapter(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    @Override
    public Optional<String> acquire(String courtId, LocalDate date) {
        String lockKey = buildLockKey(courtId, date);
        CourtLock courtLock = locks.compute(lockKey, (key, existing) -> {
            CourtLock entry = existing == null ? new CourtLock() : existing;
            entry.references++;
            return entry;
        });

        boolean acquired;
        try {
            acquired = courtLock.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("[LocalLock] Lock wait timed out: key={}, waitMs={}", lockKey, waitTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting for lock: key={}", lockKey);
            acquired = false;
        }

        if (!acquired) {
            dereference(lockKey);
            return Optional.empty();
        }

        String token = UUID.randomUUID().toString();
        owners.put(lockKey, token);
        log.debug("[LocalLock] Lock acquired: key={}", lockKey);
        return Optional.of(token);
    }

    @Override
    public void release(String courtId, LocalDate date, String ownerToken) {
        String lockKey = buildLockKey(courtId, date);
        CourtLock courtLock = locks.get(lockKey);

        if (courtLock == null || !courtLock.lock.isHeldByCurrentThread() || !owners.remove(lockKey, ownerToken)) {
            log.warn("[LocalLock] Lock not released (not owner): key={}", lockKey);
            return;
        }
        courtLock.lock.unlock();
        dereference(lockKey);
        log.debug("[LocalLock] Lock released: key={}", lockKey);
    }

    @Override
    public String getStrategyName() {
        return "local";
    }

    int lockEntryCount() {
        return locks.size();
    }

    private void dereference(String lockKey) {
        locks.computeIfPresent(lockKey, (key, entry) -> --entry.references == 0 ? null : entry);
    }

    private String buildLockKey(String courtId, LocalDate date) {
        return courtId + ":" + date;
    }

    private static final class CourtLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        // 보유 중이거나 획득을 기다리는 스레드 수
        private int references;
    }
}

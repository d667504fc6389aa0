package personal.ground.reservation.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ground.reservation.adapter.out.lock.LocalCourtLockAdapter;
import personal.ground.reservation.adapter.out.lock.NoCourtLockAdapter;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.out.CourtLockPort;
import personal.ground.reservation.application.port.out.NotificationSink;
import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.NotificationMessage;
import personal.ground.reservation.domain.service.ConflictDetector;
import personal.ground.reservation.domain.service.NotificationMessageFactory;
import personal.ground.reservation.domain.service.PricingPolicy;
import personal.ground.reservation.domain.service.RequestNormalizer;
import personal.ground.reservation.domain.service.ReservationIdGenerator;
import personal.ground.reservation.fixture.GroundFixtures;
import personal.ground.reservation.fixture.InMemoryCalendarStore;
import personal.ground.reservation.fixture.InMemoryLedgerStore;
import personal.ground.reservation.fixture.RecordingNotificationSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 같은 면, 같은 시간대로 동시에 두 건이 들어올 때의 동작
 *
 * 1. 락 없음: 두 요청 모두 중복 확인을 통과해 이중 예약 발생 (경쟁 구간 재현)
 * 2. 로컬 락: 한 건만 확정, 나머지는 중복으로 거절
 * 3. 로컬 락: 중복 알림 전송이 느려도 다른 요청이 락을 기다리지 않음
 */
@DisplayName("예약 커밋 동시성 테스트")
class ReservationCommitConcurrencyTest {

    private static final String DATE = "2025-06-04";

    private final InMemoryLedgerStore ledgerStore = new InMemoryLedgerStore();
    private final RecordingNotificationSink notificationSink = new RecordingNotificationSink();

    private ReservationCommitService createService(InMemoryCalendarStore calendarStore, CourtLockPort lockPort) {
        return createService(calendarStore, lockPort, notificationSink);
    }

    private ReservationCommitService createService(InMemoryCalendarStore calendarStore, CourtLockPort lockPort,
                                                   NotificationSink sink) {
        GroundProperties properties = GroundFixtures.groundProperties();
        PricingPolicy pricingPolicy = new PricingPolicy(properties);
        return new ReservationCommitService(
                new RequestNormalizer(properties, pricingPolicy),
                new ConflictDetector(calendarStore, properties),
                pricingPolicy,
                calendarStore,
                ledgerStore,
                lockPort,
                new NotificationDispatcher(sink),
                new NotificationMessageFactory(GroundFixtures.FIXED_CLOCK, properties),
                new ReservationIdGenerator(GroundFixtures.FIXED_CLOCK),
                GroundFixtures.FIXED_CLOCK,
                properties,
                new SimpleMeterRegistry());
    }

    private static List<CommitResult> commitConcurrently(ReservationCommitService service) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<CommitResult>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> service.commit(
                    GroundFixtures.candidate(DATE, "10:00", 2, "A", "田中太郎"))));
            futures.add(executor.submit(() -> service.commit(
                    GroundFixtures.candidate(DATE, "11:00", 2, "A", "山田花子"))));

            await().atMost(Duration.ofSeconds(10))
                    .until(() -> futures.stream().allMatch(Future::isDone));

            List<CommitResult> results = new ArrayList<>();
            for (Future<CommitResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("[none] 락이 없으면 두 요청이 모두 확정되어 이중 예약이 발생한다")
    void noLock_BothRequestsCommitted() throws Exception {
        // given - 두 요청이 모두 조회를 마친 뒤에야 기록하도록 조회 시점을 맞춘다
        CyclicBarrier bothQueried = new CyclicBarrier(2);
        InMemoryCalendarStore calendarStore = new InMemoryCalendarStore() {
            @Override
            protected void beforeQuery() {
                try {
                    bothQueried.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("barrier not reached", e);
                }
            }
        };
        ReservationCommitService service = createService(calendarStore, new NoCourtLockAdapter());

        // when
        List<CommitResult> results = commitConcurrently(service);

        // then
        assertThat(results).allMatch(CommitResult::isCommitted);
        assertThat(calendarStore.events()).hasSize(2);
        assertThat(ledgerStore.readRows()).hasSize(2);
    }

    @Test
    @DisplayName("[local] 로컬 락이 있으면 한 건만 확정되고 나머지는 중복으로 거절된다")
    void localLock_OnlyOneCommitted() throws Exception {
        // given - 조회를 느리게 하여 두 요청이 락 구간에서 겹치도록 한다
        InMemoryCalendarStore calendarStore = new InMemoryCalendarStore() {
            @Override
            protected void beforeQuery() {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        ReservationCommitService service =
                createService(calendarStore, new LocalCourtLockAdapter(Duration.ofSeconds(3)));

        // when
        List<CommitResult> results = commitConcurrently(service);

        // then
        assertThat(results).filteredOn(CommitResult::isCommitted).hasSize(1);
        assertThat(results).filteredOn(result -> result instanceof CommitResult.Conflicted).hasSize(1);
        assertThat(calendarStore.events()).hasSize(1);
        assertThat(ledgerStore.readRows()).hasSize(1);
    }

    @Test
    @DisplayName("[local] 중복 알림 전송이 지연되어도 같은 면/날짜의 다른 요청은 락을 기다리지 않고 확정된다")
    void localLock_SlowConflictNotification_DoesNotBlockOthers() throws Exception {
        // given - 중복 알림만 게이트가 열릴 때까지 멈추는 알림 채널
        CountDownLatch conflictSending = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        NotificationSink slowSink = message -> {
            if (message.kind() == NotificationMessage.Kind.CONFLICT) {
                conflictSending.countDown();
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            notificationSink.send(message);
        };
        InMemoryCalendarStore calendarStore = new InMemoryCalendarStore();
        ReservationCommitService service =
                createService(calendarStore, new LocalCourtLockAdapter(Duration.ofMillis(300)), slowSink);
        assertThat(service.commit(GroundFixtures.candidate(DATE, "10:00", 2, "A", "田中太郎")).isCommitted())
                .isTrue();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CommitResult> conflicting = executor.submit(() -> service.commit(
                    GroundFixtures.candidate(DATE, "11:00", 2, "A", "山田花子")));
            await().atMost(Duration.ofSeconds(5)).until(() -> conflictSending.getCount() == 0);

            // when - 중복 알림이 멈춰 있는 동안 같은 면/날짜의 겹치지 않는 시간대로 요청
            CommitResult other = service.commit(GroundFixtures.candidate(DATE, "14:00", 2, "A", "佐藤次郎"));
            gate.countDown();

            // then
            assertThat(other.isCommitted()).isTrue();
            assertThat(conflicting.get(5, TimeUnit.SECONDS)).isInstanceOf(CommitResult.Conflicted.class);
            assertThat(calendarStore.events()).hasSize(2);
            assertThat(notificationSink.messages(NotificationMessage.Kind.CONFLICT)).hasSize(1);
        } finally {
            gate.countDown();
            executor.shutdownNow();
        }
    }
}

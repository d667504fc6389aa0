package personal.ground.reservation.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.in.CommitReservationUseCase;
import personal.ground.reservation.application.port.out.CalendarStore;
import personal.ground.reservation.application.port.out.CourtLockPort;
import personal.ground.reservation.application.port.out.LedgerStore;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.CalendarEntry;
import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.CommitState;
import personal.ground.reservation.domain.model.Confirmation;
import personal.ground.reservation.domain.model.FeeBreakdown;
import personal.ground.reservation.domain.model.NormalizationResult;
import personal.ground.reservation.domain.model.ReservationCandidate;
import personal.ground.reservation.domain.model.ReservationRequest;
import personal.ground.reservation.domain.service.BookingLedgerCodec;
import personal.ground.reservation.domain.service.ConflictDetector;
import personal.ground.reservation.domain.service.NotificationMessageFactory;
import personal.ground.reservation.domain.service.PricingPolicy;
import personal.ground.reservation.domain.service.RequestNormalizer;
import personal.ground.reservation.domain.service.ReservationIdGenerator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Reservation Commit Service (Application Service)
 *
 * 명시적 상태 머신으로 예약을 커밋한다.
 * RECEIVED → VALIDATED → CONFLICT_CHECKED → PRICED → CALENDAR_COMMITTED → LEDGER_COMMITTED → NOTIFIED → DONE
 *
 * - 중복 확인 ~ 캘린더 기록 구간은 면/날짜 단위 락으로 직렬화 (CourtLockPort)
 * - 캘린더 기록은 1회만 시도, 실패 시 대장 기록 없이 중단
 * - 대장 기록 실패 시 캘린더 이벤트를 보상 삭제, 삭제도 실패하면 수동 정합 알림
 * - 알림 실패는 로그만 남김 (커밋된 예약을 되돌리지 않음)
 */
@Slf4j
@Service
public class ReservationCommitService implements CommitReservationUseCase {

    private static final String OUTCOME_METRIC = "reservation.commit.outcome";

    private final RequestNormalizer requestNormalizer;
    private final ConflictDetector conflictDetector;
    private final PricingPolicy pricingPolicy;
    private final CalendarStore calendarStore;
    private final LedgerStore ledgerStore;
    private final CourtLockPort courtLockPort;
    private final NotificationDispatcher notificationDispatcher;
    private final NotificationMessageFactory messageFactory;
    private final ReservationIdGenerator idGenerator;
    private final Clock clock;
    private final ZoneId zoneId;
    private final MeterRegistry meterRegistry;

    public ReservationCommitService(RequestNormalizer requestNormalizer,
                                    ConflictDetector conflictDetector,
                                    PricingPolicy pricingPolicy,
                                    CalendarStore calendarStore,
                                    LedgerStore ledgerStore,
                                    CourtLockPort courtLockPort,
                                    NotificationDispatcher notificationDispatcher,
                                    NotificationMessageFactory messageFactory,
                                    ReservationIdGenerator idGenerator,
                                    Clock clock,
                                    GroundProperties properties,
                                    MeterRegistry meterRegistry) {
        this.requestNormalizer = requestNormalizer;
        this.conflictDetector = conflictDetector;
        this.pricingPolicy = pricingPolicy;
        this.calendarStore = calendarStore;
        this.ledgerStore = ledgerStore;
        this.courtLockPort = courtLockPort;
        this.notificationDispatcher = notificationDispatcher;
        this.messageFactory = messageFactory;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.zoneId = properties.zoneId();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CommitResult commit(ReservationCandidate candidate) {
        CommitContext context = new CommitContext();
        try {
            while (!context.state.isTerminal()) {
                step(context, candidate);
            }
        } catch (Exception e) {
            log.error("Unexpected error during reservation commit: state={}", context.state, e);
            context.abort("unexpected error: " + e.getClass().getSimpleName());
        } finally {
            releaseLock(context);
        }

        Counter.builder(OUTCOME_METRIC)
                .tag("outcome", context.state.name())
                .description("Reservation commit outcomes by terminal state")
                .register(meterRegistry)
                .increment();

        return context.result;
    }

    private void step(CommitContext context, ReservationCandidate candidate) {
        switch (context.state) {
            case RECEIVED -> validate(context, candidate);
            case VALIDATED -> checkConflict(context);
            case CONFLICT_CHECKED -> price(context);
            case PRICED -> writeCalendar(context);
            case CALENDAR_COMMITTED -> writeLedger(context);
            case LEDGER_COMMITTED -> notifyOperators(context);
            case NOTIFIED -> finish(context);
            default -> throw new IllegalStateException("No step defined for state " + context.state);
        }
    }

    // RECEIVED → VALIDATED | REJECTED_VALIDATION
    private void validate(CommitContext context, ReservationCandidate candidate) {
        NormalizationResult result = requestNormalizer.normalize(candidate);

        if (result instanceof NormalizationResult.Invalid invalid) {
            context.transitionTo(CommitState.REJECTED_VALIDATION);
            context.result = new CommitResult.Rejected(invalid.error());
            return;
        }

        context.request = ((NormalizationResult.Valid) result).request();
        context.transitionTo(CommitState.VALIDATED);
    }

    // VALIDATED → CONFLICT_CHECKED → (REJECTED_CONFLICT) | FAILED
    private void checkConflict(CommitContext context) {
        ReservationRequest request = context.request;

        Optional<String> lockToken = courtLockPort.acquire(request.court().id(), request.date());
        if (lockToken.isEmpty()) {
            log.warn("Court lock not acquired: court={}, date={}, strategy={}",
                    request.court().id(), request.date(), courtLockPort.getStrategyName());
            context.fail("court lock not acquired");
            return;
        }
        context.lockToken = lockToken.get();

        boolean conflict = conflictDetector.hasConflict(request);
        context.transitionTo(CommitState.CONFLICT_CHECKED);

        if (conflict) {
            log.info("Reservation conflict: court={}, date={}, window={}~{}",
                    request.court().id(), request.date(), request.startTime(), request.endTime());
            // 알림 전송 중에는 같은 면/날짜의 다른 요청이 대기하지 않도록 락을 먼저 해제
            releaseLock(context);
            notificationDispatcher.dispatch(messageFactory.conflict(request));
            context.transitionTo(CommitState.REJECTED_CONFLICT);
            context.result = new CommitResult.Conflicted(request);
        }
    }

    // CONFLICT_CHECKED → PRICED (순수 계산, 실패 없음)
    private void price(CommitContext context) {
        ReservationRequest request = context.request;
        context.fee = pricingPolicy.computeFee(request.category().key(), request.dayType(), request.hours());
        context.transitionTo(CommitState.PRICED);
    }

    // PRICED → CALENDAR_COMMITTED | FAILED
    private void writeCalendar(CommitContext context) {
        CalendarEntry entry = CalendarEntry.of(context.request, context.fee, zoneId);
        try {
            context.calendarEventId = calendarStore.createEvent(
                    entry.summary(), entry.description(), entry.start(), entry.end(), entry.colorTag());
            log.info("Calendar event created: eventId={}, court={}, date={}",
                    context.calendarEventId, context.request.court().id(), context.request.date());
            context.transitionTo(CommitState.CALENDAR_COMMITTED);
        } catch (Exception e) {
            log.error("Calendar write failed, aborting commit without ledger write: court={}, date={}",
                    context.request.court().id(), context.request.date(), e);
            context.fail("calendar write failed");
        } finally {
            // 캘린더 기록 이후에는 중복 확인 결과에 의존하지 않으므로 락 해제
            releaseLock(context);
        }
    }

    // CALENDAR_COMMITTED → LEDGER_COMMITTED | COMPENSATED | FAILED
    private void writeLedger(CommitContext context) {
        ReservationRequest request = context.request;
        try {
            BookingRecord record = BookingLedgerCodec.newConfirmedRecord(
                    idGenerator.nextId(),
                    LocalDateTime.now(clock),
                    request,
                    context.fee,
                    context.calendarEventId);

            int row = ledgerStore.appendRow(BookingLedgerCodec.toRow(record));
            log.info("Ledger row appended: row={}, reservationId={}", row, record.reservationId());

            context.bookingRecord = record;
            context.ledgerRow = row;
            context.transitionTo(CommitState.LEDGER_COMMITTED);

        } catch (Exception e) {
            log.error("Ledger write failed after calendar commit: eventId={}, court={}, date={}",
                    context.calendarEventId, request.court().id(), request.date(), e);
            compensateCalendar(context);
        }
    }

    private void compensateCalendar(CommitContext context) {
        try {
            calendarStore.deleteEvent(context.calendarEventId);
            log.warn("Calendar event deleted as compensation: eventId={}", context.calendarEventId);
            context.failedAt = context.state;
            context.transitionTo(CommitState.COMPENSATED);
            context.result = new CommitResult.Failed(context.failedAt, CommitState.COMPENSATED,
                    "ledger write failed, calendar event compensated");
        } catch (Exception e) {
            log.error("Compensation failed, manual reconciliation required: eventId={}",
                    context.calendarEventId, e);
            notificationDispatcher.dispatch(messageFactory.reconciliationRequired(
                    context.request, context.calendarEventId, "ledger write failed"));
            context.fail("ledger write failed, compensation failed");
        }
    }

    // LEDGER_COMMITTED → NOTIFIED
    private void notifyOperators(CommitContext context) {
        boolean delivered = notificationDispatcher.dispatch(
                messageFactory.newReservation(context.request, context.fee, context.ledgerRow));
        if (!delivered) {
            log.warn("Reservation committed but notification not delivered: reservationId={}",
                    context.bookingRecord.reservationId());
        }
        context.transitionTo(CommitState.NOTIFIED);
    }

    // NOTIFIED → DONE
    private void finish(CommitContext context) {
        context.transitionTo(CommitState.DONE);
        context.result = new CommitResult.Committed(new Confirmation(
                context.request,
                context.fee,
                context.bookingRecord,
                context.ledgerRow,
                context.calendarEventId));

        log.info("Reservation committed: reservationId={}, date={}, court={}, total={}",
                context.bookingRecord.reservationId(), context.request.date(),
                context.request.court().id(), context.fee.total());
    }

    private void releaseLock(CommitContext context) {
        if (context.lockToken == null) {
            return;
        }
        ReservationRequest request = context.request;
        courtLockPort.release(request.court().id(), request.date(), context.lockToken);
        context.lockToken = null;
    }

    /**
     * 요청 단위 커밋 상태 (스레드 간 공유하지 않음)
     */
    private static final class CommitContext {

        private CommitState state = CommitState.RECEIVED;
        private CommitState failedAt;
        private ReservationRequest request;
        private FeeBreakdown fee;
        private String calendarEventId;
        private BookingRecord bookingRecord;
        private int ledgerRow;
        private String lockToken;
        private CommitResult result;

        private void transitionTo(CommitState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException(String.format("Illegal commit transition: %s -> %s", state, next));
            }
            log.debug("Commit state transition: {} -> {}", state, next);
            state = next;
        }

        private void fail(String reason) {
            failedAt = state;
            transitionTo(CommitState.FAILED);
            result = new CommitResult.Failed(failedAt, CommitState.FAILED, reason);
        }

        private void abort(String reason) {
            failedAt = state;
            state = CommitState.FAILED;
            result = new CommitResult.Failed(failedAt, CommitState.FAILED, reason);
        }
    }
}

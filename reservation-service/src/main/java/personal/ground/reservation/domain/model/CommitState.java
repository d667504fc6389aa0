package personal.ground.reservation.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 예약 커밋 상태 머신
 *
 * <pre>
 * RECEIVED → VALIDATED → CONFLICT_CHECKED → PRICED → CALENDAR_COMMITTED → LEDGER_COMMITTED → NOTIFIED → DONE
 * RECEIVED → REJECTED_VALIDATION
 * CONFLICT_CHECKED → REJECTED_CONFLICT
 * VALIDATED | PRICED → FAILED              (락 획득 실패, 캘린더 기록 실패)
 * CALENDAR_COMMITTED → COMPENSATED | FAILED (대장 기록 실패 후 보상 삭제)
 * </pre>
 */
public enum CommitState {
    RECEIVED,
    VALIDATED,
    CONFLICT_CHECKED,
    PRICED,
    CALENDAR_COMMITTED,
    LEDGER_COMMITTED,
    NOTIFIED,
    DONE,
    REJECTED_VALIDATION,
    REJECTED_CONFLICT,
    COMPENSATED,
    FAILED;

    public Set<CommitState> nextStates() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(VALIDATED, REJECTED_VALIDATION);
            case VALIDATED -> EnumSet.of(CONFLICT_CHECKED, FAILED);
            case CONFLICT_CHECKED -> EnumSet.of(PRICED, REJECTED_CONFLICT);
            case PRICED -> EnumSet.of(CALENDAR_COMMITTED, FAILED);
            case CALENDAR_COMMITTED -> EnumSet.of(LEDGER_COMMITTED, COMPENSATED, FAILED);
            case LEDGER_COMMITTED -> EnumSet.of(NOTIFIED);
            case NOTIFIED -> EnumSet.of(DONE);
            default -> EnumSet.noneOf(CommitState.class);
        };
    }

    public boolean canTransitionTo(CommitState next) {
        return nextStates().contains(next);
    }

    public boolean isTerminal() {
        return nextStates().isEmpty();
    }
}

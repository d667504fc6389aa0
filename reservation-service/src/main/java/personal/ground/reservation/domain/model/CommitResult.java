package personal.ground.reservation.domain.model;

/**
 * 예약 커밋 결과
 * 모든 실패 경로가 시그니처에 드러나도록 예외 대신 결과 타입으로 반환
 */
public sealed interface CommitResult {

    /**
     * 캘린더, 대장 기록까지 완료 (알림은 best-effort)
     */
    record Committed(Confirmation confirmation) implements CommitResult {
    }

    /**
     * 입력 검증 실패 (외부 기록 없음)
     */
    record Rejected(ValidationError error) implements CommitResult {
    }

    /**
     * 같은 면, 같은 시간대에 기존 예약 존재 (외부 기록 없음, 운영자 알림만 발송)
     */
    record Conflicted(ReservationRequest request) implements CommitResult {
    }

    /**
     * 시스템 오류. failedAt은 실패 직전까지 도달한 상태
     */
    record Failed(CommitState failedAt, CommitState finalState, String reason) implements CommitResult {
    }

    default boolean isCommitted() {
        return this instanceof Committed;
    }
}

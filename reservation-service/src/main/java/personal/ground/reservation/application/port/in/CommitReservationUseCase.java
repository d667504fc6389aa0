package personal.ground.reservation.application.port.in;

import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.ReservationCandidate;

/**
 * Commit Reservation UseCase (Input Port)
 * 예약 후보를 검증 → 중복 확인 → 요금 계산 → 캘린더 → 대장 → 알림 순으로 커밋
 */
public interface CommitReservationUseCase {

    /**
     * 예약 커밋
     * 같은 내용을 두 번 호출하면 두 건이 기록된다 (중복 제거는 호출자 책임)
     *
     * @param candidate 추출기가 만든 예약 후보
     * @return 커밋 결과 (예외를 던지지 않음)
     */
    CommitResult commit(ReservationCandidate candidate);
}

package personal.ground.reservation.domain.model;

/**
 * 추출기 결과
 * 추출 실패나 파싱 불가 응답은 "예약 아님"으로 취급 (치명적 오류가 아님)
 *
 * @param reservation 예약 요청 여부
 * @param candidate   예약 후보 (reservation=false 이면 null)
 * @param error       실패 사유 (없으면 null)
 */
public record ExtractionResult(
        boolean reservation,
        ReservationCandidate candidate,
        String error
) {
    public static ExtractionResult reservation(ReservationCandidate candidate) {
        return new ExtractionResult(true, candidate, null);
    }

    public static ExtractionResult notReservation() {
        return new ExtractionResult(false, null, null);
    }

    public static ExtractionResult failed(String error) {
        return new ExtractionResult(false, null, error);
    }
}

package personal.ground.reservation.domain.model;

/**
 * Reservation Candidate
 * 추출기(Extractor)가 만든 신뢰할 수 없는 예약 후보.
 * 모든 필드는 선택값이며 RequestNormalizer를 통과해야만 코어에 진입한다.
 */
public record ReservationCandidate(
        String date,
        String startTime,
        String endTime,
        Integer hours,
        String court,
        String category,
        Boolean weekend,
        String name,
        String phone,
        String notes,
        Double confidence
) {
}

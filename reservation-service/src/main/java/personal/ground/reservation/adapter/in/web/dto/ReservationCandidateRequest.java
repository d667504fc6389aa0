package personal.ground.reservation.adapter.in.web.dto;

import personal.ground.reservation.domain.model.ReservationCandidate;

/**
 * 구조화된 예약 요청 DTO
 * 추출기를 거치지 않는 호출자용. 검증은 RequestNormalizer가 수행하므로 여기서는 하지 않음
 */
public record ReservationCandidateRequest(
        String date,
        String startTime,
        String endTime,
        Integer hours,
        String court,
        String category,
        Boolean weekend,
        String name,
        String phone,
        String notes
) {
    public ReservationCandidate toCandidate() {
        return new ReservationCandidate(date, startTime, endTime, hours, court, category, weekend,
                name, phone, notes, null);
    }
}

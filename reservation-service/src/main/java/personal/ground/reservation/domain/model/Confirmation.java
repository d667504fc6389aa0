package personal.ground.reservation.domain.model;

/**
 * Confirmation
 * 커밋 성공 결과. 호출자가 영수증 문구를 만들 수 있을 만큼의 정보를 담는다
 */
public record Confirmation(
        ReservationRequest request,
        FeeBreakdown fee,
        BookingRecord bookingRecord,
        int ledgerRow,
        String calendarEventId
) {
}

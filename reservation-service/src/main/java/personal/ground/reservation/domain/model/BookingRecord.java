package personal.ground.reservation.domain.model;

/**
 * Booking Record
 * 대장(ledger) 한 행. 컬럼 순서는 BookingLedgerCodec이 정의하는 호환성 계약을 따른다.
 * 날짜/시각은 대장에 기록된 텍스트 그대로 보관 (YYYY-MM-DD, HH:MM)
 */
public record BookingRecord(
        String reservationId,
        String receivedAt,
        String date,
        String dayOfWeek,
        String startTime,
        String endTime,
        String court,
        String name,
        String phone,
        String categoryLabel,
        String hours,
        String rate,
        String totalFee,
        String dayType,
        String status,
        String calendarEventId,
        String notes
) {
    public boolean isCancelled() {
        return BookingStatus.CANCELLED.label().equals(status);
    }

    public String timeRange() {
        return startTime + "〜" + endTime;
    }
}

package personal.ground.reservation.adapter.in.web.dto;

import personal.ground.reservation.domain.model.BookingRecord;

/**
 * 대장 행 응답 DTO (연락처 제외)
 */
public record BookingRecordResponse(
        String reservationId,
        String date,
        String startTime,
        String endTime,
        String court,
        String name,
        String category,
        String totalFee,
        String status
) {
    public static BookingRecordResponse from(BookingRecord record) {
        return new BookingRecordResponse(
                record.reservationId(),
                record.date(),
                record.startTime(),
                record.endTime(),
                record.court(),
                record.name(),
                record.categoryLabel(),
                record.totalFee(),
                record.status()
        );
    }
}

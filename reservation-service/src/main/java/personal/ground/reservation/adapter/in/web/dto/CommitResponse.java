package personal.ground.reservation.adapter.in.web.dto;

import personal.ground.reservation.domain.model.CommitResult;
import personal.ground.reservation.domain.model.Confirmation;
import personal.ground.reservation.domain.model.ReservationRequest;

import java.util.List;

/**
 * 예약 커밋 결과 응답 DTO
 *
 * @param outcome       COMMITTED | REJECTED | CONFLICTED | FAILED
 * @param reservation   확정 예약 (COMMITTED 일 때만)
 * @param missingFields 누락 항목 (REJECTED 일 때만)
 * @param invalidFields 잘못된 항목 (REJECTED 일 때만)
 * @param failedState   실패 직전 상태 (FAILED 일 때만)
 */
public record CommitResponse(
        String outcome,
        ConfirmedReservation reservation,
        List<String> missingFields,
        List<String> invalidFields,
        String failedState
) {
    public record ConfirmedReservation(
            String reservationId,
            String date,
            String startTime,
            String endTime,
            int hours,
            String court,
            String name,
            String category,
            String dayType,
            long hourlyRate,
            long totalFee,
            String paymentMethod,
            int ledgerRow,
            String calendarEventId
    ) {
        static ConfirmedReservation from(Confirmation confirmation) {
            ReservationRequest request = confirmation.request();
            return new ConfirmedReservation(
                    confirmation.bookingRecord().reservationId(),
                    request.date().toString(),
                    confirmation.bookingRecord().startTime(),
                    confirmation.bookingRecord().endTime(),
                    request.hours(),
                    request.court().id(),
                    request.name(),
                    confirmation.fee().categoryLabel(),
                    confirmation.fee().dayType().label(),
                    confirmation.fee().hourlyRate(),
                    confirmation.fee().total(),
                    confirmation.fee().paymentMethod(),
                    confirmation.ledgerRow(),
                    confirmation.calendarEventId()
            );
        }
    }

    public static CommitResponse from(CommitResult result) {
        if (result instanceof CommitResult.Committed committed) {
            return new CommitResponse("COMMITTED", ConfirmedReservation.from(committed.confirmation()),
                    List.of(), List.of(), null);
        }
        if (result instanceof CommitResult.Rejected rejected) {
            return new CommitResponse("REJECTED", null,
                    rejected.error().missingFields(), rejected.error().invalidFields(), null);
        }
        if (result instanceof CommitResult.Conflicted) {
            return new CommitResponse("CONFLICTED", null, List.of(), List.of(), null);
        }
        CommitResult.Failed failed = (CommitResult.Failed) result;
        return new CommitResponse("FAILED", null, List.of(), List.of(), failed.failedAt().name());
    }
}

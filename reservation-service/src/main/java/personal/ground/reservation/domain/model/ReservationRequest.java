package personal.ground.reservation.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Reservation Request Domain Model
 * 정규화가 끝난 예약 요청 (불변). 파생값은 모두 여기에 기록되어 하위 컴포넌트가 다시 계산하지 않음
 */
public record ReservationRequest(
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        int hours,
        Court court,
        Category category,
        DayType dayType,
        String name,
        String phone,
        String notes
) {
    public ReservationRequest {
        if (date == null) {
            throw new IllegalArgumentException("Date cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("Start and end time cannot be null");
        }
        if (hours <= 0) {
            throw new IllegalArgumentException("Hours must be positive: " + hours);
        }
        if (!startTime.plusHours(hours).equals(endTime)) {
            throw new IllegalArgumentException(
                    String.format("End time must equal start time + hours: start=%s, hours=%d, end=%s",
                            startTime, hours, endTime));
        }
        if (court == null || category == null || dayType == null) {
            throw new IllegalArgumentException("Court, category and day type cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
        phone = phone == null ? "" : phone;
        notes = notes == null ? "" : notes;
    }
}

package personal.ground.reservation.domain.model;

import java.time.OffsetDateTime;

/**
 * Calendar Event
 * 캘린더 스토어가 소유하는 이벤트. 코어는 ID와 시간대만 사용
 */
public record CalendarEvent(
        String id,
        String summary,
        OffsetDateTime start,
        OffsetDateTime end
) {
    public boolean labelContains(String text) {
        return summary != null && summary.contains(text);
    }
}

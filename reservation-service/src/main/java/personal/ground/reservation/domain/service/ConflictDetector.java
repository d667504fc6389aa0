package personal.ground.reservation.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.out.CalendarStore;
import personal.ground.reservation.domain.model.CalendarEvent;
import personal.ground.reservation.domain.model.ReservationRequest;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Conflict Detector (Domain Service)
 * 요청 시간대 [start, end) 에 같은 면의 기존 이벤트가 있는지 캘린더에서 확인한다.
 *
 * 면 판정은 이벤트 제목에 면 ID 텍스트가 포함되는지로 한다 (대소문자 구분 부분 일치).
 * 구조화된 리소스 ID 조인이 아니므로 제목 규칙이 지켜지지 않으면 과다/과소 일치가 가능하다.
 */
@Slf4j
@Component
public class ConflictDetector {

    private final CalendarStore calendarStore;
    private final ZoneId zoneId;

    public ConflictDetector(CalendarStore calendarStore, GroundProperties properties) {
        this.calendarStore = calendarStore;
        this.zoneId = properties.zoneId();
    }

    /**
     * 중복 예약 여부 확인
     *
     * 조회 실패 시 가용성을 우선하여 false 반환 (장애 중 이중 예약이 들어올 수 있음 → WARN 로그)
     */
    public boolean hasConflict(ReservationRequest request) {
        String courtId = request.court().id();
        OffsetDateTime windowStart = request.date().atTime(request.startTime()).atZone(zoneId).toOffsetDateTime();
        OffsetDateTime windowEnd = request.date().atTime(request.endTime()).atZone(zoneId).toOffsetDateTime();

        try {
            List<CalendarEvent> events = calendarStore.queryEvents(windowStart, windowEnd, courtId);

            boolean conflict = events.stream().anyMatch(event -> event.labelContains(courtId));

            log.debug("Conflict check: court={}, window=[{}, {}), events={}, conflict={}",
                    courtId, windowStart, windowEnd, events.size(), conflict);
            return conflict;

        } catch (Exception e) {
            log.warn("Conflict check failed, admitting request without conflict check (double-booking possible): "
                            + "court={}, window=[{}, {}), error={}",
                    courtId, windowStart, windowEnd, e.getMessage(), e);
            return false;
        }
    }
}

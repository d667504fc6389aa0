package personal.ground.reservation.application.port.out;

import personal.ground.reservation.domain.model.CalendarEvent;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Calendar Store (Output Port)
 * 예약 캘린더 연동 인터페이스
 */
public interface CalendarStore {

    /**
     * 시간대 [timeMin, timeMax) 와 겹치는 이벤트 조회
     *
     * @param textFilter 자유 텍스트 필터 (스토어 측 검색 힌트, 최종 판정은 호출자가 수행)
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 조회 실패 시
     */
    List<CalendarEvent> queryEvents(OffsetDateTime timeMin, OffsetDateTime timeMax, String textFilter);

    /**
     * 이벤트 생성
     *
     * @return 생성된 이벤트 ID
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 생성 실패 시
     */
    String createEvent(String summary, String description, OffsetDateTime start, OffsetDateTime end, String colorTag);

    /**
     * 이벤트 삭제 (대장 기록 실패 시 보상 트랜잭션용)
     *
     * @throws personal.ground.reservation.domain.exception.ExternalStoreException 삭제 실패 시
     */
    void deleteEvent(String eventId);
}

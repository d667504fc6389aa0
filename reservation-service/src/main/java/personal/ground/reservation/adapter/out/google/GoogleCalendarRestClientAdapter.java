package personal.ground.reservation.adapter.out.google;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ground.common.exception.ErrorCode;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.out.CalendarStore;
import personal.ground.reservation.domain.exception.ExternalStoreException;
import personal.ground.reservation.domain.model.CalendarEvent;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Calendar REST Client Adapter
 * Calendar API v3 (events.list / events.insert / events.delete)
 *
 * - 조회: Circuit Breaker + Retry (읽기는 재시도 안전)
 * - 생성: Circuit Breaker만 적용. 중복 이벤트 방지를 위해 재시도하지 않음
 * - 삭제: 보상 트랜잭션용, 1회 시도
 */
@Slf4j
@Component
public class GoogleCalendarRestClientAdapter implements CalendarStore {

    private static final String EVENTS_PATH = "/calendars/{calendarId}/events";
    private static final String EVENT_PATH = "/calendars/{calendarId}/events/{eventId}";

    // '+09:00' 의 '+'가 쿼리에서 공백으로 해석되지 않도록 UTC로 변환하여 전송
    private static final DateTimeFormatter QUERY_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final RestClient restClient;
    private final String calendarId;
    private final String timeZone;

    public GoogleCalendarRestClientAdapter(@Qualifier("googleCalendarRestClient") RestClient restClient,
                                           ExternalApiProperties externalApiProperties,
                                           GroundProperties groundProperties) {
        this.restClient = restClient;
        this.calendarId = externalApiProperties.google().calendarId();
        this.timeZone = groundProperties.timeZone();
    }

    @Override
    @CircuitBreaker(name = "googleCalendar", fallbackMethod = "queryEventsFallback")
    @Retry(name = "googleCalendarRead")
    public List<CalendarEvent> queryEvents(OffsetDateTime timeMin, OffsetDateTime timeMax, String textFilter) {
        log.debug("Querying calendar events: timeMin={}, timeMax={}, q={}", timeMin, timeMax, textFilter);

        JsonNode body = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(EVENTS_PATH)
                        .queryParam("timeMin", toQueryTime(timeMin))
                        .queryParam("timeMax", toQueryTime(timeMax))
                        .queryParam("q", textFilter)
                        .queryParam("singleEvents", true)
                        .build(calendarId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.CALENDAR_STORE_ERROR,
                            "events.list failed: status=" + response.getStatusCode());
                })
                .body(JsonNode.class);

        List<CalendarEvent> events = new ArrayList<>();
        if (body != null && body.has("items")) {
            for (JsonNode item : body.get("items")) {
                events.add(toCalendarEvent(item));
            }
        }
        return events;
    }

    @Override
    @CircuitBreaker(name = "googleCalendar", fallbackMethod = "createEventFallback")
    public String createEvent(String summary, String description, OffsetDateTime start, OffsetDateTime end,
                              String colorTag) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("summary", summary);
        event.put("description", description);
        event.put("start", Map.of("dateTime", start.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), "timeZone", timeZone));
        event.put("end", Map.of("dateTime", end.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), "timeZone", timeZone));
        if (colorTag != null && !colorTag.isBlank()) {
            event.put("colorId", colorTag);
        }

        JsonNode created = restClient.post()
                .uri(EVENTS_PATH, calendarId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(event)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.CALENDAR_STORE_ERROR,
                            "events.insert failed: status=" + response.getStatusCode());
                })
                .body(JsonNode.class);

        if (created == null || !created.hasNonNull("id")) {
            throw new ExternalStoreException(ErrorCode.CALENDAR_STORE_ERROR,
                    "events.insert returned no event id");
        }
        return created.get("id").asText();
    }

    @Override
    @CircuitBreaker(name = "googleCalendar", fallbackMethod = "deleteEventFallback")
    public void deleteEvent(String eventId) {
        restClient.delete()
                .uri(EVENT_PATH, calendarId, eventId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.CALENDAR_STORE_ERROR,
                            "events.delete failed: status=" + response.getStatusCode());
                })
                .toBodilessEntity();

        log.info("Calendar event deleted: eventId={}", eventId);
    }

    private List<CalendarEvent> queryEventsFallback(OffsetDateTime timeMin, OffsetDateTime timeMax,
                                                    String textFilter, Exception e) {
        log.error("Calendar query unavailable: timeMin={}, timeMax={}, error={}",
                timeMin, timeMax, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.calendar("events.list unavailable", e);
    }

    private String createEventFallback(String summary, String description, OffsetDateTime start,
                                       OffsetDateTime end, String colorTag, Exception e) {
        log.error("Calendar insert unavailable: start={}, error={}", start, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.calendar("events.insert unavailable", e);
    }

    private void deleteEventFallback(String eventId, Exception e) {
        log.error("Calendar delete unavailable: eventId={}, error={}", eventId, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.calendar("events.delete unavailable", e);
    }

    private CalendarEvent toCalendarEvent(JsonNode item) {
        return new CalendarEvent(
                item.path("id").asText(null),
                item.path("summary").asText(""),
                parseEventTime(item.path("start")),
                parseEventTime(item.path("end")));
    }

    /**
     * 종일 이벤트는 date만 있으므로 시각 없이 null 처리
     */
    private OffsetDateTime parseEventTime(JsonNode node) {
        JsonNode dateTime = node.get("dateTime");
        return dateTime == null || dateTime.isNull() ? null : OffsetDateTime.parse(dateTime.asText());
    }

    private static String toQueryTime(OffsetDateTime time) {
        return time.withOffsetSameInstant(ZoneOffset.UTC).format(QUERY_TIME_FORMAT);
    }
}

package personal.ground.reservation.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.Court;
import personal.ground.reservation.domain.model.DayType;
import personal.ground.reservation.domain.model.NormalizationResult;
import personal.ground.reservation.domain.model.ReservationCandidate;
import personal.ground.reservation.domain.model.ReservationRequest;
import personal.ground.reservation.domain.model.ValidationError;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Request Normalizer (Domain Service)
 * 신뢰할 수 없는 예약 후보를 검증하고 정규화한다.
 * 실패는 예외가 아닌 Invalid 결과로 반환하며, 누락 항목은 한 번에 모두 보고한다
 */
@Slf4j
@Component
public class RequestNormalizer {

    public static final String FIELD_DATE = "ご利用日";
    public static final String FIELD_START_TIME = "開始時間";
    public static final String FIELD_NAME = "お名前";
    public static final String FIELD_END_TIME = "終了時間";
    public static final String FIELD_COURT = "グラウンド";
    public static final String FIELD_TIME_RANGE = "利用時間";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");
    private static final int HOURS_PER_DAY = 24;
    private static final int MINUTES_PER_DAY = HOURS_PER_DAY * 60;

    private final GroundProperties properties;
    private final PricingPolicy pricingPolicy;

    public RequestNormalizer(GroundProperties properties, PricingPolicy pricingPolicy) {
        this.properties = properties;
        this.pricingPolicy = pricingPolicy;
    }

    public NormalizationResult normalize(ReservationCandidate candidate) {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        // 1. 필수 항목 확인 (모든 누락 항목 수집)
        LocalDate date = null;
        if (isBlank(candidate.date())) {
            missing.add(FIELD_DATE);
        } else {
            date = parseDate(candidate.date(), invalid);
        }

        LocalTime startTime = null;
        if (isBlank(candidate.startTime())) {
            missing.add(FIELD_START_TIME);
        } else {
            startTime = parseTime(candidate.startTime(), FIELD_START_TIME, invalid);
        }

        if (isBlank(candidate.name())) {
            missing.add(FIELD_NAME);
        }

        LocalTime requestedEnd = isBlank(candidate.endTime())
                ? null
                : parseTime(candidate.endTime(), FIELD_END_TIME, invalid);

        // 2. 면 확인 (미지정 시 기본 면)
        Court court = resolveCourt(candidate.court(), invalid);

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            return reject(missing, invalid);
        }

        // 3. 이용 시간 (최소 시간 보정, 단위 올림)
        Integer requestedHours = candidate.hours();
        if (requestedHours == null && requestedEnd != null && requestedEnd.isAfter(startTime)) {
            long minutes = Duration.between(startTime, requestedEnd).toMinutes();
            requestedHours = (int) ((minutes + 59) / 60);
        }
        // 하루를 넘는 값은 시각/요금 계산 전에 거부 (int 오버플로, LocalTime 순환 방지)
        if (requestedHours != null && requestedHours > HOURS_PER_DAY) {
            log.info("Requested hours out of range: hours={}", requestedHours);
            invalid.add(FIELD_TIME_RANGE + "（" + HOURS_PER_DAY + "時間以内で指定してください）");
            return reject(missing, invalid);
        }
        int hours = normalizeHours(requestedHours);

        // 4. 종료 시각 = 시작 + 이용 시간
        int endMinutes = startTime.getHour() * 60 + startTime.getMinute() + hours * 60;
        if (endMinutes > MINUTES_PER_DAY) {
            invalid.add(FIELD_TIME_RANGE + "（日をまたぐ予約はできません）");
            return reject(missing, invalid);
        }
        LocalTime endTime = startTime.plusHours(hours);
        if (requestedEnd != null && !requestedEnd.equals(endTime)) {
            log.info("End time recomputed from normalized hours: requestedEnd={}, normalizedEnd={}, hours={}",
                    requestedEnd, endTime, hours);
        }

        // 5. 영업시간 확인
        if (!withinBusinessHours(startTime, endMinutes)) {
            invalid.add(String.format("%s（営業時間 %s〜%s）", FIELD_TIME_RANGE,
                    properties.businessHours().open(), properties.businessHours().close()));
            return reject(missing, invalid);
        }

        // 6. 이용자 구분 (미지정/알 수 없음 → 기본 구분)
        Category category = pricingPolicy.resolveCategory(candidate.category());

        // 7. 요일 구분 (명시 플래그 우선, 없으면 요일로 판정)
        DayType dayType = candidate.weekend() != null
                ? DayType.of(candidate.weekend())
                : deriveDayType(date);

        ReservationRequest request = new ReservationRequest(
                date,
                startTime,
                endTime,
                hours,
                court,
                category,
                dayType,
                candidate.name().trim(),
                trimToEmpty(candidate.phone()),
                trimToEmpty(candidate.notes()));

        log.debug("Candidate normalized: date={}, start={}, end={}, hours={}, court={}, category={}, dayType={}",
                date, startTime, endTime, hours, court.id(), category.key(), dayType);

        return NormalizationResult.valid(request);
    }

    /**
     * 이용 시간 정규화
     * 미지정 → 최소 시간, 최소 미만 → 최소 시간, 단위 배수가 아니면 다음 배수로 올림 (내림 금지)
     */
    public int normalizeHours(Integer requested) {
        int minimum = pricingPolicy.minBookingHours();
        int unit = pricingPolicy.unitHours();
        int hours = requested == null ? minimum : Math.max(requested, minimum);
        if (hours % unit != 0) {
            hours = (hours / unit + 1) * unit;
        }
        return hours;
    }

    public DayType deriveDayType(LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return DayType.of(properties.weekendDays().contains(dayOfWeek));
    }

    private boolean withinBusinessHours(LocalTime startTime, int endMinutes) {
        LocalTime open = properties.businessHours().openTime();
        LocalTime close = properties.businessHours().closeTime();
        int closeMinutes = close.getHour() * 60 + close.getMinute();
        return !startTime.isBefore(open) && endMinutes <= closeMinutes;
    }

    private Court resolveCourt(String requested, List<String> invalid) {
        if (isBlank(requested)) {
            return properties.resolveDefaultCourt();
        }
        return properties.findCourt(requested.trim()).orElseGet(() -> {
            String allowed = properties.courtList().stream()
                    .map(Court::id)
                    .collect(Collectors.joining(" / "));
            invalid.add(String.format("%s（%s）", FIELD_COURT, allowed));
            return null;
        });
    }

    private LocalDate parseDate(String text, List<String> invalid) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            invalid.add(FIELD_DATE + "（YYYY-MM-DD）");
            return null;
        }
    }

    private LocalTime parseTime(String text, String field, List<String> invalid) {
        try {
            return LocalTime.parse(text.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            invalid.add(field + "（HH:MM）");
            return null;
        }
    }

    private NormalizationResult reject(List<String> missing, List<String> invalid) {
        log.info("Candidate rejected: missing={}, invalid={}", missing, invalid);
        return NormalizationResult.invalid(new ValidationError(missing, invalid));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}

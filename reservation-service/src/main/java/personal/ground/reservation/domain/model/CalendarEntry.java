package personal.ground.reservation.domain.model;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * 캘린더에 기록할 예약 이벤트 내용
 * 제목은 "【면】이름様" 형식이며 ConflictDetector의 면 텍스트 판정이 이 규칙에 의존한다
 */
public record CalendarEntry(
        String summary,
        String description,
        OffsetDateTime start,
        OffsetDateTime end,
        String colorTag
) {
    public static CalendarEntry of(ReservationRequest request, FeeBreakdown fee, ZoneId zoneId) {
        String summary = String.format("【%s】%s様", request.court().id(), request.name());
        String description = String.format(Locale.JAPAN,
                "お名前: %s%n連絡先: %s%nグラウンド: %s%n利用者区分: %s%n料金: ¥%,d（%,d円/h × %dh / %s）%n支払い: %s%n備考: %s",
                request.name(),
                request.phone(),
                request.court().id(),
                fee.categoryLabel(),
                fee.total(),
                fee.hourlyRate(),
                fee.hours(),
                fee.dayType().label(),
                fee.paymentMethod(),
                request.notes());

        return new CalendarEntry(
                summary,
                description,
                request.date().atTime(request.startTime()).atZone(zoneId).toOffsetDateTime(),
                request.date().atTime(request.endTime()).atZone(zoneId).toOffsetDateTime(),
                request.court().colorId());
    }
}

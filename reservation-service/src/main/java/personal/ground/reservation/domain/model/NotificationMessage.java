package personal.ground.reservation.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 운영자 알림 메시지 (전송 채널 독립적인 구조화 메시지)
 *
 * @param kind        알림 종류
 * @param title       제목
 * @param description 본문 (선택)
 * @param fields      항목 목록
 * @param footer      하단 문구 (선택)
 */
public record NotificationMessage(
        Kind kind,
        String title,
        String description,
        List<Field> fields,
        String footer
) {
    public NotificationMessage {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public enum Kind {
        NEW_RESERVATION,
        CONFLICT,
        CANCEL_REQUEST,
        DAILY_SUMMARY,
        RECONCILIATION_REQUIRED
    }

    public record Field(String name, String value, boolean inline) {
    }

    public NotificationMessage withField(String name, String value, boolean inline) {
        List<Field> extended = new ArrayList<>(fields);
        extended.add(new Field(name, value, inline));
        return new NotificationMessage(kind, title, description, extended, footer);
    }
}

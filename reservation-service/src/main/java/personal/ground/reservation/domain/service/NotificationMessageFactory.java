package personal.ground.reservation.domain.service;

import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.FeeBreakdown;
import personal.ground.reservation.domain.model.NotificationMessage;
import personal.ground.reservation.domain.model.NotificationMessage.Field;
import personal.ground.reservation.domain.model.NotificationMessage.Kind;
import personal.ground.reservation.domain.model.ReservationRequest;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 운영자 알림 메시지 생성
 */
@Component
public class NotificationMessageFactory {

    private static final DateTimeFormatter FOOTER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final Clock clock;
    private final String groundName;

    public NotificationMessageFactory(Clock clock, GroundProperties properties) {
        this.clock = clock;
        this.groundName = properties.name();
    }

    public NotificationMessage newReservation(ReservationRequest request, FeeBreakdown fee, int ledgerRow) {
        String dayTypeText = fee.dayType().isWeekendOrHoliday() ? "🟡 土日祝料金" : "🔵 平日料金";

        List<Field> fields = new ArrayList<>();
        fields.add(new Field("📅 日時", dateTimeText(request), false));
        fields.add(new Field("🏟️ グラウンド", request.court().id(), true));
        fields.add(new Field("👤 お名前", request.name(), true));
        fields.add(new Field("📞 連絡先", orUnset(request.phone()), true));
        fields.add(new Field("👥 利用者区分", fee.categoryLabel(), true));
        fields.add(new Field("⏱️ 利用時間", fee.hours() + "時間", true));
        fields.add(new Field("💰 料金", String.format(Locale.JAPAN, "¥%,d%n（%,d円/h × %dh）%n%s",
                fee.total(), fee.hourlyRate(), fee.hours(), dayTypeText), true));
        if (!request.notes().isBlank()) {
            fields.add(new Field("📝 備考", request.notes(), false));
        }

        String footer = String.format("台帳 行%d | 支払い：%s | %s",
                ledgerRow, fee.paymentMethod(), LocalDateTime.now(clock).format(FOOTER_FORMAT));
        return new NotificationMessage(Kind.NEW_RESERVATION, "✅ 新規予約", null, fields, footer);
    }

    public NotificationMessage conflict(ReservationRequest request) {
        String description = String.format("**%s**%nグラウンド：%s%n申請者：%s / %s",
                dateTimeText(request), request.court().id(), request.name(), orUnset(request.phone()));
        return new NotificationMessage(Kind.CONFLICT, "🔴 重複予約リクエスト", description, List.of(),
                "すでに予約済みのため自動でブロックしました");
    }

    public NotificationMessage cancelRequest(String rawText) {
        return new NotificationMessage(Kind.CANCEL_REQUEST, "⚠️ キャンセル申請", rawText, List.of(),
                LocalDateTime.now(clock).format(FOOTER_FORMAT));
    }

    public NotificationMessage reconciliationRequired(ReservationRequest request, String calendarEventId, String reason) {
        String description = String.format("%s%nグラウンド：%s%n申請者：%s%nカレンダーID：%s%n原因：%s",
                dateTimeText(request), request.court().id(), request.name(), calendarEventId, reason);
        return new NotificationMessage(Kind.RECONCILIATION_REQUIRED, "🛠️ 台帳とカレンダーの不整合", description,
                List.of(), "カレンダー予定の削除に失敗しました。手動で確認してください");
    }

    public NotificationMessage dailySummary(LocalDate date, List<BookingRecord> records, long totalFee) {
        String title = String.format("📊 本日の予約サマリー　%s（%s）", date, BookingLedgerCodec.dayOfWeekLabel(date));

        List<Field> fields = new ArrayList<>();
        fields.add(new Field("予約件数", records.size() + "件", true));
        fields.add(new Field("売上合計", String.format(Locale.JAPAN, "¥%,d", totalFee), true));
        if (!records.isEmpty()) {
            String lines = records.stream()
                    .map(record -> String.format("・%s　%s様　[%s]　¥%s",
                            record.timeRange(), record.name(), record.court(),
                            record.totalFee().isBlank() ? "?" : record.totalFee()))
                    .collect(Collectors.joining("\n"));
            fields.add(new Field("予約一覧", lines, false));
        }
        return new NotificationMessage(Kind.DAILY_SUMMARY, title, null, fields, groundName + " 自動集計");
    }

    private String dateTimeText(ReservationRequest request) {
        return String.format("%s（%s） %s〜%s",
                request.date(),
                BookingLedgerCodec.dayOfWeekLabel(request.date()),
                request.startTime().format(TIME_FORMAT),
                request.endTime().format(TIME_FORMAT));
    }

    private static String orUnset(String value) {
        return value == null || value.isBlank() ? "未記入" : value;
    }
}

package personal.ground.reservation.application.service;

import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.Confirmation;
import personal.ground.reservation.domain.model.Court;
import personal.ground.reservation.domain.model.FeeBreakdown;
import personal.ground.reservation.domain.model.MonthlySummary;
import personal.ground.reservation.domain.model.ReservationRequest;
import personal.ground.reservation.domain.model.ValidationError;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 이용자 회신 문구 생성 (일본어)
 */
@Component
public class ReplyMessageFormatter {

    public static final String SYSTEM_ERROR = "システムエラーが発生しました。お手数ですが直接ご連絡ください。";
    public static final String CANCEL_ACKNOWLEDGED =
            "キャンセルのご連絡ありがとうございます。管理者が確認の上、折り返しご連絡します。";
    public static final String IMAGE_NOT_READ = "画像から予約情報を読み取れませんでした。\nテキストでご連絡ください。";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final GroundProperties properties;

    public ReplyMessageFormatter(GroundProperties properties) {
        this.properties = properties;
    }

    public String confirmation(Confirmation confirmation) {
        ReservationRequest request = confirmation.request();
        FeeBreakdown fee = confirmation.fee();
        return "✅ 予約を受け付けました！\n\n"
                + "📅 " + dateTimeText(request) + "\n"
                + "🏟️ グラウンド：" + request.court().id() + "\n"
                + "👤 お名前：" + request.name() + "\n"
                + "📞 連絡先：" + orUnset(request.phone()) + "\n"
                + "👥 区分：" + fee.categoryLabel() + "\n"
                + "⏱️ 利用時間：" + fee.hours() + "時間\n"
                + "💰 料金：" + yen(fee.total()) + "（" + fee.paymentMethod() + "）\n\n"
                + "後ほど請求書をお送りします。\nご利用ありがとうございます🙏";
    }

    public String remediation(ValidationError error) {
        List<String> lines = new ArrayList<>(error.missingFields());
        error.invalidFields().forEach(field -> lines.add(field + "（内容をご確認ください）"));

        String header = error.hasMissingFields()
                ? "以下の情報が不足しています。再度ご連絡ください。"
                : "以下の情報をご確認の上、再度ご連絡ください。";
        return header + "\n\n" + lines.stream().map(line -> "・" + line).collect(Collectors.joining("\n"));
    }

    public String conflict(ReservationRequest request) {
        return "⚠️ 申し訳ございません。\n"
                + request.date() + " " + request.startTime().format(TIME_FORMAT) + "〜"
                + request.endTime().format(TIME_FORMAT) + "は"
                + "すでに予約が入っております。\n別の日時でご検討ください。";
    }

    public String todayList(LocalDate today, List<BookingRecord> records) {
        if (records.isEmpty()) {
            return "本日（" + today + "）の予約はありません。";
        }
        StringBuilder text = new StringBuilder("📋 本日の予約一覧（" + today + "）\n\n");
        for (BookingRecord record : records) {
            text.append("・").append(record.timeRange()).append(" ")
                    .append(record.name()).append("様 [").append(record.court()).append("]\n");
        }
        return text.toString();
    }

    public String monthlySummary(MonthlySummary summary) {
        return String.format("📊 %d年%d月の集計%n%n予約件数：%d件%nキャンセル：%d件%n売上合計：%s",
                summary.year(), summary.month(), summary.count(), summary.cancelledCount(),
                yen(summary.totalFee()));
    }

    public String invalidMonth(String argument) {
        return "集計月の形式が正しくありません（例：/月次集計 2025-06）：" + argument;
    }

    public String help() {
        String courts = properties.courtList().stream().map(Court::id).collect(Collectors.joining(" or "));
        String categories = properties.categoryList().stream().map(Category::label).collect(Collectors.joining(" / "));
        int unitHours = properties.pricing().unitHours();

        return properties.name() + "予約窓口です。\n\n"
                + "【予約方法】\n"
                + "以下をテキストで送ってください：\n"
                + "・ご利用日\n"
                + "・時間（" + unitHours + "時間単位）\n"
                + "・グラウンド種別（" + courts + "）\n"
                + "・お名前\n"
                + "・連絡先（電話番号）\n"
                + "・利用者区分（" + categories + "）\n\n"
                + "【例】\n"
                + "6月7日 9時〜11時、" + properties.resolveDefaultCourt().id() + "、田中太郎、\n"
                + "090-1234-5678、一般\n\n"
                + "【管理者コマンド】\n"
                + "/予約一覧 → 本日の予約確認\n"
                + "/キャンセル [日付] [名前] → キャンセル申請\n"
                + "/月次集計 [YYYY-MM] → 月間の予約件数と売上";
    }

    private String dateTimeText(ReservationRequest request) {
        return String.format("%s（%s） %s〜%s",
                request.date(),
                BookingLedgerCodec.dayOfWeekLabel(request.date()),
                request.startTime().format(TIME_FORMAT),
                request.endTime().format(TIME_FORMAT));
    }

    static String yen(long amount) {
        return String.format(Locale.JAPAN, "¥%,d", amount);
    }

    private static String orUnset(String value) {
        return value == null || value.isBlank() ? "未記入" : value;
    }
}

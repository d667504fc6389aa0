package personal.ground.reservation.domain.service;

import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.BookingStatus;
import personal.ground.reservation.domain.model.FeeBreakdown;
import personal.ground.reservation.domain.model.ReservationRequest;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 예약 대장 행 코덱
 * 17개 위치 기반 컬럼. 컬럼 순서는 대장을 읽는 모든 쪽과의 호환성 계약이므로 변경 금지
 */
public final class BookingLedgerCodec {

    public static final List<String> HEADERS = List.of(
            "予約ID", "受付日時", "利用日", "曜日", "開始時間", "終了時間",
            "グラウンド", "お名前", "連絡先", "利用者区分",
            "利用時間(h)", "単価(円/h)", "料金(円)", "平日/土日祝",
            "ステータス", "カレンダーID", "備考");

    public static final int COLUMN_COUNT = HEADERS.size();
    public static final int DATE_COLUMN = 2;
    public static final int TOTAL_FEE_COLUMN = 12;
    public static final int STATUS_COLUMN = 14;

    private static final String[] DAY_OF_WEEK_LABELS = {"月", "火", "水", "木", "金", "土", "日"};
    private static final DateTimeFormatter RECEIVED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private BookingLedgerCodec() {
    }

    /**
     * 확정 상태의 신규 대장 행 생성
     */
    public static BookingRecord newConfirmedRecord(String reservationId,
                                                   LocalDateTime receivedAt,
                                                   ReservationRequest request,
                                                   FeeBreakdown fee,
                                                   String calendarEventId) {
        return new BookingRecord(
                reservationId,
                receivedAt.format(RECEIVED_AT_FORMAT),
                request.date().toString(),
                dayOfWeekLabel(request.date()),
                request.startTime().format(TIME_FORMAT),
                request.endTime().format(TIME_FORMAT),
                request.court().id(),
                request.name(),
                request.phone(),
                fee.categoryLabel(),
                String.valueOf(fee.hours()),
                String.valueOf(fee.hourlyRate()),
                String.valueOf(fee.total()),
                fee.dayType().label(),
                BookingStatus.CONFIRMED.label(),
                calendarEventId,
                request.notes());
    }

    /**
     * 대장 기록용 컬럼 배열 (숫자 컬럼은 숫자로 기록)
     */
    public static List<Object> toRow(BookingRecord record) {
        List<Object> row = new ArrayList<>(COLUMN_COUNT);
        row.add(record.reservationId());
        row.add(record.receivedAt());
        row.add(record.date());
        row.add(record.dayOfWeek());
        row.add(record.startTime());
        row.add(record.endTime());
        row.add(record.court());
        row.add(record.name());
        row.add(record.phone());
        row.add(record.categoryLabel());
        row.add(numberOrText(record.hours()));
        row.add(numberOrText(record.rate()));
        row.add(numberOrText(record.totalFee()));
        row.add(record.dayType());
        row.add(record.status());
        row.add(record.calendarEventId());
        row.add(record.notes());
        return row;
    }

    /**
     * 대장 행 → BookingRecord (짧은 행은 빈 문자열로 채움)
     */
    public static BookingRecord fromRow(List<String> row) {
        List<String> cells = new ArrayList<>(COLUMN_COUNT);
        for (int i = 0; i < COLUMN_COUNT; i++) {
            String value = row != null && i < row.size() ? row.get(i) : null;
            cells.add(value == null ? "" : value);
        }
        return new BookingRecord(
                cells.get(0), cells.get(1), cells.get(2), cells.get(3),
                cells.get(4), cells.get(5), cells.get(6), cells.get(7),
                cells.get(8), cells.get(9), cells.get(10), cells.get(11),
                cells.get(12), cells.get(13), cells.get(14), cells.get(15),
                cells.get(16));
    }

    public static String dayOfWeekLabel(LocalDate date) {
        return DAY_OF_WEEK_LABELS[date.getDayOfWeek().getValue() - 1];
    }

    private static Object numberOrText(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }
}

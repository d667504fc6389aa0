package personal.ground.reservation.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.MonthlySummary;
import personal.ground.reservation.fixture.GroundFixtures;
import personal.ground.reservation.fixture.InMemoryLedgerStore;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LedgerQueryService 단위 테스트")
class LedgerQueryServiceTest {

    private InMemoryLedgerStore ledgerStore;
    private LedgerQueryService queryService;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        queryService = new LedgerQueryService(ledgerStore, GroundFixtures.FIXED_CLOCK,
                GroundFixtures.groundProperties());
    }

    private static List<String> row(String id, String date, String start, String totalFee, String status) {
        return List.of(id, "2025-06-01 09:00:00", date, "水", start, "23:00", "A", "田中太郎",
                "090-1234-5678", "一般", "2", "12000", totalFee, "平日", status, "evt-" + id, "");
    }

    @Test
    @DisplayName("오늘 예약 목록 - 오늘 날짜만, 취소 제외, 시작 시각 순")
    void listToday() {
        // given
        ledgerStore.addRow(row("R3", "2025-06-04", "15:00", "24000", "確定"));
        ledgerStore.addRow(row("R1", "2025-06-04", "09:00", "24000", "確定"));
        ledgerStore.addRow(row("R2", "2025-06-04", "11:00", "24000", "キャンセル"));
        ledgerStore.addRow(row("R4", "2025-06-05", "07:00", "24000", "確定"));

        // when
        List<BookingRecord> records = queryService.listToday();

        // then
        assertThat(records).extracting(BookingRecord::reservationId).containsExactly("R1", "R3");
    }

    @Test
    @DisplayName("오늘 예약 목록 - 열이 부족한 행도 읽는다")
    void listToday_ShortRows() {
        // given
        ledgerStore.addRow(List.of("R1", "2025-06-01 09:00:00", "2025-06-04", "水", "09:00"));

        // when
        List<BookingRecord> records = queryService.listToday();

        // then
        assertThat(records).hasSize(1);
        assertThat(records.get(0).totalFee()).isEmpty();
    }

    @Test
    @DisplayName("월간 집계 - 취소는 건수/매출에서 제외하고 취소 건수로만 집계")
    void monthlySummary() {
        // given
        ledgerStore.addRow(row("R1", "2025-06-04", "09:00", "24000", "確定"));
        ledgerStore.addRow(row("R2", "2025-06-07", "09:00", "52,000", "確定"));
        ledgerStore.addRow(row("R3", "2025-06-10", "09:00", "24000", "キャンセル"));
        ledgerStore.addRow(row("R4", "2025-07-01", "09:00", "24000", "確定"));

        // when
        MonthlySummary summary = queryService.monthlySummary(2025, 6);

        // then
        assertThat(summary).isEqualTo(new MonthlySummary(2025, 6, 2, 1, 76000));
    }

    @Test
    @DisplayName("월간 집계 - 요금이 비었거나 숫자가 아니면 0으로 계산")
    void monthlySummary_MalformedFee() {
        // given
        ledgerStore.addRow(row("R1", "2025-06-04", "09:00", "", "確定"));
        ledgerStore.addRow(row("R2", "2025-06-05", "09:00", "未定", "確定"));
        ledgerStore.addRow(row("R3", "2025-06-06", "09:00", "12000", "確定"));

        // when
        MonthlySummary summary = queryService.monthlySummary(2025, 6);

        // then
        assertThat(summary.count()).isEqualTo(3);
        assertThat(summary.totalFee()).isEqualTo(12000);
    }

    @Test
    @DisplayName("월간 집계 - 해당 월 데이터가 없으면 0건")
    void monthlySummary_Empty() {
        // when
        MonthlySummary summary = queryService.monthlySummary(2024, 1);

        // then
        assertThat(summary).isEqualTo(new MonthlySummary(2024, 1, 0, 0, 0));
    }

    @Test
    @DisplayName("월간 집계 - 월이 1-12 범위를 벗어나면 예외")
    void monthlySummary_InvalidMonth() {
        assertThatThrownBy(() -> queryService.monthlySummary(2025, 13))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package personal.ground.reservation.fixture;

import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.config.GroundProperties.BusinessHours;
import personal.ground.reservation.application.config.GroundProperties.CategoryRate;
import personal.ground.reservation.application.config.GroundProperties.CourtEntry;
import personal.ground.reservation.application.config.GroundProperties.Pricing;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.Court;
import personal.ground.reservation.domain.model.DayType;
import personal.ground.reservation.domain.model.ReservationCandidate;
import personal.ground.reservation.domain.model.ReservationRequest;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트 공용 그라운드 설정 (면 A/B, 2시간 단위, 07:00-21:00)
 */
public final class GroundFixtures {

    public static final ZoneId ZONE = ZoneId.of("Asia/Tokyo");
    public static final String PAYMENT_METHOD = "前払い（請求書）";

    // 2025-06-04 (수) 10:00 JST
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-06-04T01:00:00Z"), ZONE);

    public static final Court COURT_A = new Court("A", "Aグラウンド", "9");
    public static final Court COURT_B = new Court("B", "Bグラウンド", "6");
    public static final Category GENERAL = new Category("general", "一般", 12000, 13000);

    private GroundFixtures() {
    }

    public static GroundProperties groundProperties() {
        Map<String, CategoryRate> categories = new LinkedHashMap<>();
        categories.put("elementary", new CategoryRate("小学生", 6000, 7000));
        categories.put("middle_high", new CategoryRate("中・高校生", 7000, 8000));
        categories.put("general", new CategoryRate("一般", 12000, 13000));

        return new GroundProperties(
                "テストグラウンド",
                "Asia/Tokyo",
                List.of(new CourtEntry("A", "Aグラウンド", "9"), new CourtEntry("B", "Bグラウンド", "6")),
                "A",
                List.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY),
                new BusinessHours("07:00", "21:00"),
                new Pricing(2, 2, "general", categories, PAYMENT_METHOD));
    }

    public static ReservationCandidate candidate(String date, String startTime, Integer hours, String court,
                                                 String name) {
        return new ReservationCandidate(date, startTime, null, hours, court, null, null, name,
                "090-1234-5678", null, 0.95);
    }

    public static ReservationRequest request(LocalDate date, LocalTime start, int hours, Court court) {
        return new ReservationRequest(date, start, start.plusHours(hours), hours, court, GENERAL,
                DayType.WEEKDAY, "田中太郎", "090-1234-5678", "");
    }
}

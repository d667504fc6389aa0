package personal.ground.reservation.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.Court;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ground 설정 Properties
 * application.yml의 ground.* 설정을 바인딩하는 불변 설정값.
 * 모든 컴포넌트는 생성자로 이 값을 주입받으며 전역 조회를 하지 않는다
 */
@ConfigurationProperties(prefix = "ground")
public record GroundProperties(
        String name,
        String timeZone,
        List<CourtEntry> courts,
        String defaultCourt,
        List<DayOfWeek> weekendDays,
        BusinessHours businessHours,
        Pricing pricing
) {
    public GroundProperties {
        if (courts == null || courts.isEmpty()) {
            throw new IllegalArgumentException("ground.courts must not be empty");
        }
        if (pricing == null) {
            throw new IllegalArgumentException("ground.pricing must be configured");
        }
        name = name == null ? "" : name;
        timeZone = timeZone == null ? "Asia/Tokyo" : timeZone;
        courts = List.copyOf(courts);
        defaultCourt = defaultCourt == null ? courts.get(0).id() : defaultCourt;
        weekendDays = weekendDays == null || weekendDays.isEmpty()
                ? List.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)
                : List.copyOf(weekendDays);
        businessHours = businessHours == null ? new BusinessHours("07:00", "21:00") : businessHours;
    }

    public record CourtEntry(
            String id,
            String name,
            String colorId
    ) {
        public Court toCourt() {
            return new Court(id, name, colorId);
        }
    }

    public record BusinessHours(
            String open,
            String close
    ) {
        public LocalTime openTime() {
            return LocalTime.parse(open);
        }

        public LocalTime closeTime() {
            return LocalTime.parse(close);
        }
    }

    public record Pricing(
            int minBookingHours,
            int unitHours,
            String defaultCategory,
            Map<String, CategoryRate> categories,
            String paymentMethod
    ) {
        public Pricing {
            if (unitHours <= 0) {
                throw new IllegalArgumentException("ground.pricing.unit-hours must be positive");
            }
            if (minBookingHours <= 0) {
                minBookingHours = unitHours;
            }
            if (categories == null || categories.isEmpty()) {
                throw new IllegalArgumentException("ground.pricing.categories must not be empty");
            }
            categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
            defaultCategory = defaultCategory == null ? "general" : defaultCategory;
            if (!categories.containsKey(defaultCategory)) {
                throw new IllegalArgumentException("Unknown default category: " + defaultCategory);
            }
            paymentMethod = paymentMethod == null ? "" : paymentMethod;
        }
    }

    public record CategoryRate(
            String label,
            long weekday,
            long weekend
    ) {
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public List<Court> courtList() {
        return courts.stream().map(CourtEntry::toCourt).toList();
    }

    public Optional<Court> findCourt(String text) {
        return courtList().stream().filter(court -> court.matches(text)).findFirst();
    }

    public Court resolveDefaultCourt() {
        return findCourt(defaultCourt)
                .orElseThrow(() -> new IllegalStateException("Default court is not configured: " + defaultCourt));
    }

    public List<Category> categoryList() {
        List<Category> result = new ArrayList<>();
        pricing.categories().forEach((key, rate) ->
                result.add(new Category(key, rate.label() == null ? key : rate.label(), rate.weekday(), rate.weekend())));
        return result;
    }
}

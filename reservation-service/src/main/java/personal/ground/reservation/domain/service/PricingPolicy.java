package personal.ground.reservation.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.DayType;
import personal.ground.reservation.domain.model.FeeBreakdown;

import java.util.List;

/**
 * Pricing Policy (Domain Service)
 * (이용자 구분, 요일 구분, 이용 시간) → 요금 내역. 부수 효과 없는 순수 계산
 */
@Slf4j
@Component
public class PricingPolicy {

    private final List<Category> categories;
    private final Category defaultCategory;
    private final String paymentMethod;
    private final int minBookingHours;
    private final int unitHours;

    public PricingPolicy(GroundProperties properties) {
        GroundProperties.Pricing pricing = properties.pricing();
        this.categories = properties.categoryList();
        this.defaultCategory = categories.stream()
                .filter(category -> category.key().equals(pricing.defaultCategory()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Default category missing: " + pricing.defaultCategory()));
        this.paymentMethod = pricing.paymentMethod();
        this.minBookingHours = pricing.minBookingHours();
        this.unitHours = pricing.unitHours();
    }

    /**
     * 요금 계산
     * 알 수 없는 구분은 기본(일반) 구분으로 대체하며 WARN 로그를 남긴다
     *
     * @param categoryKey 구분 키 또는 라벨
     * @param dayType     평일/주말·공휴일
     * @param hours       이용 시간 (양의 정수)
     */
    public FeeBreakdown computeFee(String categoryKey, DayType dayType, int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("Hours must be positive: " + hours);
        }
        Category category = resolveCategory(categoryKey);
        long rate = category.rateFor(dayType);

        return new FeeBreakdown(
                category.key(),
                category.label(),
                rate,
                hours,
                rate * hours,
                dayType,
                paymentMethod);
    }

    /**
     * 구분 키 또는 라벨로 요금 구분 조회 (없으면 기본 구분)
     */
    public Category resolveCategory(String keyOrLabel) {
        if (keyOrLabel == null || keyOrLabel.isBlank()) {
            return defaultCategory;
        }
        return categories.stream()
                .filter(category -> category.key().equals(keyOrLabel) || category.label().equals(keyOrLabel))
                .findFirst()
                .orElseGet(() -> {
                    log.warn("Unknown category, falling back to default: requested={}, fallback={}",
                            keyOrLabel, defaultCategory.key());
                    return defaultCategory;
                });
    }

    public boolean isKnownCategory(String keyOrLabel) {
        return categories.stream()
                .anyMatch(category -> category.key().equals(keyOrLabel) || category.label().equals(keyOrLabel));
    }

    public Category defaultCategory() {
        return defaultCategory;
    }

    public int minBookingHours() {
        return minBookingHours;
    }

    public int unitHours() {
        return unitHours;
    }

    public List<Category> categories() {
        return categories;
    }
}

package personal.ground.reservation.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.DayType;
import personal.ground.reservation.domain.model.FeeBreakdown;
import personal.ground.reservation.fixture.GroundFixtures;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PricingPolicy 단위 테스트")
class PricingPolicyTest {

    private final PricingPolicy pricingPolicy = new PricingPolicy(GroundFixtures.groundProperties());

    @Test
    @DisplayName("일반 / 평일 / 2시간 → 24,000엔")
    void computeFee_GeneralWeekday() {
        // when
        FeeBreakdown fee = pricingPolicy.computeFee("general", DayType.WEEKDAY, 2);

        // then
        assertThat(fee.hourlyRate()).isEqualTo(12000);
        assertThat(fee.total()).isEqualTo(24000);
        assertThat(fee.categoryLabel()).isEqualTo("一般");
        assertThat(fee.paymentMethod()).isEqualTo(GroundFixtures.PAYMENT_METHOD);
    }

    @Test
    @DisplayName("주말·공휴일은 주말 단가 적용")
    void computeFee_Weekend() {
        // when
        FeeBreakdown fee = pricingPolicy.computeFee("elementary", DayType.WEEKEND_OR_HOLIDAY, 4);

        // then
        assertThat(fee.hourlyRate()).isEqualTo(7000);
        assertThat(fee.total()).isEqualTo(28000);
        assertThat(fee.dayType()).isEqualTo(DayType.WEEKEND_OR_HOLIDAY);
    }

    @Test
    @DisplayName("라벨로도 구분을 찾는다")
    void computeFee_ByLabel() {
        // when
        FeeBreakdown fee = pricingPolicy.computeFee("中・高校生", DayType.WEEKDAY, 2);

        // then
        assertThat(fee.categoryKey()).isEqualTo("middle_high");
        assertThat(fee.total()).isEqualTo(14000);
    }

    @Test
    @DisplayName("알 수 없는 구분은 기본(일반) 요금으로 대체")
    void computeFee_UnknownCategoryFallsBack() {
        // when
        FeeBreakdown fee = pricingPolicy.computeFee("senior", DayType.WEEKDAY, 2);

        // then
        assertThat(fee.categoryKey()).isEqualTo("general");
        assertThat(fee.total()).isEqualTo(24000);
    }

    @Test
    @DisplayName("구분 미지정 시 기본 구분")
    void resolveCategory_Blank() {
        // when
        Category category = pricingPolicy.resolveCategory(null);

        // then
        assertThat(category.key()).isEqualTo("general");
        assertThat(pricingPolicy.isKnownCategory("senior")).isFalse();
    }

    @Test
    @DisplayName("이용 시간이 0 이하이면 예외")
    void computeFee_NonPositiveHours() {
        assertThatThrownBy(() -> pricingPolicy.computeFee("general", DayType.WEEKDAY, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hours must be positive");
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 결과")
    void computeFee_Deterministic() {
        assertThat(pricingPolicy.computeFee("general", DayType.WEEKDAY, 6))
                .isEqualTo(pricingPolicy.computeFee("general", DayType.WEEKDAY, 6));
    }
}

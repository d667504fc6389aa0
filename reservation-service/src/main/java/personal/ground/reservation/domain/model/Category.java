package personal.ground.reservation.domain.model;

/**
 * 이용자 구분 (요금 티어)
 *
 * @param key         내부 키 (예: general)
 * @param label       표시용 라벨 (예: 一般)
 * @param weekdayRate 평일 시간당 요금 (엔)
 * @param weekendRate 주말/공휴일 시간당 요금 (엔)
 */
public record Category(
        String key,
        String label,
        long weekdayRate,
        long weekendRate
) {
    public Category {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Category key cannot be blank");
        }
        if (weekdayRate < 0 || weekendRate < 0) {
            throw new IllegalArgumentException("Category rates must not be negative: key=" + key);
        }
    }

    public long rateFor(DayType dayType) {
        return dayType.isWeekendOrHoliday() ? weekendRate : weekdayRate;
    }
}

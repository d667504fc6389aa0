package personal.ground.reservation.domain.model;

/**
 * Day Type Enum
 * 요금 단가를 결정하는 요일 구분
 */
public enum DayType {
    WEEKDAY("平日"),
    WEEKEND_OR_HOLIDAY("土日祝");

    private final String label;

    DayType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isWeekendOrHoliday() {
        return this == WEEKEND_OR_HOLIDAY;
    }

    public static DayType of(boolean weekendOrHoliday) {
        return weekendOrHoliday ? WEEKEND_OR_HOLIDAY : WEEKDAY;
    }
}

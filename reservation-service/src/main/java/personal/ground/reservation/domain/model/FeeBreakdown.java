package personal.ground.reservation.domain.model;

/**
 * Fee Breakdown
 * 요청마다 새로 계산되는 요금 내역 (단독 저장되지 않음)
 */
public record FeeBreakdown(
        String categoryKey,
        String categoryLabel,
        long hourlyRate,
        int hours,
        long total,
        DayType dayType,
        String paymentMethod
) {
    public FeeBreakdown {
        if (total != hourlyRate * hours) {
            throw new IllegalArgumentException(
                    String.format("Total must equal rate x hours: rate=%d, hours=%d, total=%d",
                            hourlyRate, hours, total));
        }
    }
}

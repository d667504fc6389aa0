package personal.ground.reservation.domain.model;

/**
 * 월간 집계 (취소 행은 count/totalFee에서 제외, cancelledCount에만 포함)
 */
public record MonthlySummary(
        int year,
        int month,
        int count,
        int cancelledCount,
        long totalFee
) {
}

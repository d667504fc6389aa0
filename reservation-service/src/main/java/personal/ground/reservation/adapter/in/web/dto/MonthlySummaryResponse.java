package personal.ground.reservation.adapter.in.web.dto;

import personal.ground.reservation.domain.model.MonthlySummary;

public record MonthlySummaryResponse(
        int year,
        int month,
        int count,
        int cancelledCount,
        long totalFee
) {
    public static MonthlySummaryResponse from(MonthlySummary summary) {
        return new MonthlySummaryResponse(
                summary.year(),
                summary.month(),
                summary.count(),
                summary.cancelledCount(),
                summary.totalFee()
        );
    }
}

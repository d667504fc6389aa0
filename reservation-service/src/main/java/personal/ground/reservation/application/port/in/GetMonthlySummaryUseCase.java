package personal.ground.reservation.application.port.in;

import personal.ground.reservation.domain.model.MonthlySummary;

/**
 * Get Monthly Summary UseCase (Input Port)
 */
public interface GetMonthlySummaryUseCase {

    MonthlySummary monthlySummary(int year, int month);
}

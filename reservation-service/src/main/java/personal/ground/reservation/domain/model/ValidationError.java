package personal.ground.reservation.domain.model;

import java.util.List;

/**
 * Validation Error
 * 누락된 필수 항목과 잘못된 항목을 모두 담는다 (첫 번째 항목만이 아님)
 */
public record ValidationError(
        List<String> missingFields,
        List<String> invalidFields
) {
    public ValidationError {
        missingFields = List.copyOf(missingFields);
        invalidFields = List.copyOf(invalidFields);
    }

    public boolean hasMissingFields() {
        return !missingFields.isEmpty();
    }
}

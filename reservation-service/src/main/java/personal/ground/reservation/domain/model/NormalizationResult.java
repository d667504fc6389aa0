package personal.ground.reservation.domain.model;

/**
 * 정규화 결과 (Valid | Invalid)
 * 신뢰할 수 없는 후보가 타입이 보장된 코어로 들어가는 유일한 경계
 */
public sealed interface NormalizationResult {

    record Valid(ReservationRequest request) implements NormalizationResult {
    }

    record Invalid(ValidationError error) implements NormalizationResult {
    }

    static NormalizationResult valid(ReservationRequest request) {
        return new Valid(request);
    }

    static NormalizationResult invalid(ValidationError error) {
        return new Invalid(error);
    }
}

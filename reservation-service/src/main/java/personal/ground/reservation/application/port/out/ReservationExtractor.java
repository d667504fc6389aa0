package personal.ground.reservation.application.port.out;

import personal.ground.reservation.domain.model.ExtractionResult;

import java.time.LocalDate;

/**
 * Reservation Extractor (Output Port)
 * 자연어/이미지 → 예약 후보 변환. 구현체는 예외를 던지지 않고 실패를 "예약 아님"으로 반환
 */
public interface ReservationExtractor {

    ExtractionResult extractFromText(String text, LocalDate today);

    ExtractionResult extractFromImage(byte[] image, String mediaType, LocalDate today);
}

package personal.ground.reservation.application.port.in;

import personal.ground.reservation.domain.model.BookingRecord;

import java.util.List;

/**
 * Get Today Reservations UseCase (Input Port)
 */
public interface GetTodayReservationsUseCase {

    /**
     * 오늘 날짜의 확정 예약 목록 (취소 제외, 시작 시각 오름차순)
     */
    List<BookingRecord> listToday();
}

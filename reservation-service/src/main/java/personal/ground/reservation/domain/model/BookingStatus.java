package personal.ground.reservation.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Booking Status Enum
 * 대장(ledger) 행의 상태. 행은 삭제되지 않고 상태만 전이됨
 */
public enum BookingStatus {
    /**
     * 예약 확정
     */
    CONFIRMED("確定"),

    /**
     * 취소 (운영자 취소 워크플로우에서만 전이)
     */
    CANCELLED("キャンセル");

    private final String label;

    BookingStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<BookingStatus> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(status -> status.label.equals(label))
                .findFirst();
    }
}

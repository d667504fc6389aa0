package personal.ground.reservation.domain.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 예약 ID 생성기
 * 형식: R{yyyyMMddHHmmss}-{시퀀스}
 * 예: R20250607091500-001
 *
 * 같은 초에 여러 건이 들어와도 시퀀스로 구분된다 (0-999, 순환)
 */
@Component
public class ReservationIdGenerator {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private final AtomicInteger sequence = new AtomicInteger(0);
    private final Clock clock;

    public ReservationIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        String timestamp = LocalDateTime.now(clock).format(ID_FORMAT);
        int next = sequence.getAndUpdate(current -> (current + 1) % 1000);
        return String.format("R%s-%03d", timestamp, next);
    }
}

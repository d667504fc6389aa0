package personal.ground.reservation.adapter.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.in.GetTodayReservationsUseCase;
import personal.ground.reservation.application.service.NotificationDispatcher;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.service.NotificationMessageFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Daily Summary Scheduler
 * 당일 예약 목록과 매출 합계를 운영자 채널로 전송
 *
 * 설정:
 * - reservation.daily-summary.enabled=true 일 때만 등록
 * - reservation.daily-summary.cron (기본 매일 21:00, 그라운드 시간대)
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reservation.daily-summary.enabled", havingValue = "true")
public class DailySummaryScheduler {

    private final GetTodayReservationsUseCase getTodayReservationsUseCase;
    private final NotificationDispatcher notificationDispatcher;
    private final NotificationMessageFactory messageFactory;
    private final Clock clock;
    private final ZoneId zoneId;

    public DailySummaryScheduler(GetTodayReservationsUseCase getTodayReservationsUseCase,
                                 NotificationDispatcher notificationDispatcher,
                                 NotificationMessageFactory messageFactory,
                                 Clock clock,
                                 GroundProperties properties) {
        this.getTodayReservationsUseCase = getTodayReservationsUseCase;
        this.notificationDispatcher = notificationDispatcher;
        this.messageFactory = messageFactory;
        this.clock = clock;
        this.zoneId = properties.zoneId();
    }

    @Scheduled(cron = "${reservation.daily-summary.cron:0 0 21 * * *}", zone = "${ground.time-zone:Asia/Tokyo}")
    public void sendDailySummary() {
        LocalDate today = LocalDate.now(clock.withZone(zoneId));
        try {
            List<BookingRecord> records = getTodayReservationsUseCase.listToday();
            long totalFee = records.stream().mapToLong(DailySummaryScheduler::feeOf).sum();

            boolean delivered = notificationDispatcher.dispatch(messageFactory.dailySummary(today, records, totalFee));
            log.info("Daily summary processed: date={}, count={}, totalFee={}, delivered={}",
                    today, records.size(), totalFee, delivered);
        } catch (Exception e) {
            log.error("Daily summary failed: date={}", today, e);
        }
    }

    private static long feeOf(BookingRecord record) {
        try {
            return Long.parseLong(record.totalFee().replace(",", "").trim());
        } catch (NumberFormatException e) {
            log.warn("Malformed fee cell skipped in daily summary: reservationId={}", record.reservationId());
            return 0;
        }
    }
}

package personal.ground.reservation.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.in.GetMonthlySummaryUseCase;
import personal.ground.reservation.application.port.in.GetTodayReservationsUseCase;
import personal.ground.reservation.application.port.out.LedgerStore;
import personal.ground.reservation.domain.model.BookingRecord;
import personal.ground.reservation.domain.model.MonthlySummary;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Ledger Query Service (Application Service)
 * 대장 조회 전용. 기록은 하지 않는다
 */
@Slf4j
@Service
public class LedgerQueryService implements GetTodayReservationsUseCase, GetMonthlySummaryUseCase {

    private final LedgerStore ledgerStore;
    private final Clock clock;
    private final ZoneId zoneId;

    public LedgerQueryService(LedgerStore ledgerStore, Clock clock, GroundProperties properties) {
        this.ledgerStore = ledgerStore;
        this.clock = clock;
        this.zoneId = properties.zoneId();
    }

    @Override
    public List<BookingRecord> listToday() {
        String today = LocalDate.now(clock.withZone(zoneId)).toString();

        List<BookingRecord> records = ledgerStore.readRows().stream()
                .map(BookingLedgerCodec::fromRow)
                .filter(record -> today.equals(record.date()))
                .filter(record -> !record.isCancelled())
                .sorted(Comparator.comparing(BookingRecord::startTime))
                .toList();

        log.debug("Today's reservations loaded: date={}, count={}", today, records.size());
        return records;
    }

    @Override
    public MonthlySummary monthlySummary(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12: " + month);
        }
        String prefix = String.format("%04d-%02d", year, month);

        int count = 0;
        int cancelledCount = 0;
        long totalFee = 0;

        for (List<String> row : ledgerStore.readRows()) {
            BookingRecord record = BookingLedgerCodec.fromRow(row);
            if (!record.date().startsWith(prefix)) {
                continue;
            }
            if (record.isCancelled()) {
                cancelledCount++;
                continue;
            }
            count++;
            totalFee += parseFee(record);
        }

        log.info("Monthly summary computed: month={}, count={}, cancelled={}, totalFee={}",
                prefix, count, cancelledCount, totalFee);
        return new MonthlySummary(year, month, count, cancelledCount, totalFee);
    }

    private long parseFee(BookingRecord record) {
        String fee = record.totalFee().replace(",", "").trim();
        if (fee.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(fee);
        } catch (NumberFormatException e) {
            log.warn("Malformed fee cell skipped: reservationId={}, value={}", record.reservationId(), record.totalFee());
            return 0;
        }
    }
}

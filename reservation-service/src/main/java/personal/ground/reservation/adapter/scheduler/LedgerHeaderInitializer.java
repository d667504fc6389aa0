package personal.ground.reservation.adapter.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.ground.reservation.application.port.out.LedgerStore;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

/**
 * 기동 시 대장 헤더 행 확인
 * 실패해도 기동은 계속한다 (대장 기록 시점에 다시 실패가 드러남)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reservation.ledger.init-header", havingValue = "true", matchIfMissing = true)
public class LedgerHeaderInitializer implements ApplicationRunner {

    private final LedgerStore ledgerStore;

    @Override
    public void run(ApplicationArguments args) {
        try {
            ledgerStore.ensureHeaderRow(BookingLedgerCodec.HEADERS);
        } catch (Exception e) {
            log.warn("Ledger header check failed, continuing startup: error={}", e.getMessage());
        }
    }
}

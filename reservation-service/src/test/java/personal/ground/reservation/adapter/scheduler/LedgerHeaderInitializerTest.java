package personal.ground.reservation.adapter.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ground.reservation.application.port.out.LedgerStore;
import personal.ground.reservation.domain.exception.ExternalStoreException;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
@DisplayName("LedgerHeaderInitializer 테스트")
class LedgerHeaderInitializerTest {

    @Mock
    private LedgerStore ledgerStore;

    @InjectMocks
    private LedgerHeaderInitializer initializer;

    @Test
    @DisplayName("기동 시 대장 헤더 확인")
    void run() {
        // when
        initializer.run(null);

        // then
        then(ledgerStore).should().ensureHeaderRow(BookingLedgerCodec.HEADERS);
    }

    @Test
    @DisplayName("헤더 확인 실패해도 기동은 계속")
    void run_Failure() {
        // given
        willThrow(ExternalStoreException.ledger("sheets unavailable", null))
                .given(ledgerStore).ensureHeaderRow(BookingLedgerCodec.HEADERS);

        // when & then
        assertThatCode(() -> initializer.run(null)).doesNotThrowAnyException();
    }
}

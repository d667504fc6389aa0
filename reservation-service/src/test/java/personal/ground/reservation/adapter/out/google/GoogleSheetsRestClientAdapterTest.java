package personal.ground.reservation.adapter.out.google;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import personal.ground.reservation.adapter.out.RestClientConfig;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.domain.exception.ExternalStoreException;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

@WireMockTest
@DisplayName("GoogleSheetsRestClientAdapter 테스트")
class GoogleSheetsRestClientAdapterTest {

    private static final String VALUES_URL = "/spreadsheets/sheet-1/values/Ledger.*";

    private GoogleSheetsRestClientAdapter adapter;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        String baseUrl = wmRuntimeInfo.getHttpBaseUrl();
        ExternalApiProperties properties = new ExternalApiProperties(
                new ExternalApiProperties.Google("test-token", baseUrl, "cal-1", baseUrl, "sheet-1", "Ledger",
                        new ExternalApiProperties.Timeout(200, 1000)),
                null,
                null);

        adapter = new GoogleSheetsRestClientAdapter(
                new RestClientConfig().googleSheetsRestClient(properties), properties);
    }

    @Test
    @DisplayName("행 추가 - USER_ENTERED로 추가하고 updatedRange에서 행 번호 반환")
    void appendRow() {
        // given
        stubFor(post(urlPathMatching(VALUES_URL + ":append"))
                .willReturn(okJson("""
                        {"updates": {"updatedRange": "Ledger!A7:Q7", "updatedRows": 1}}
                        """)));

        // when
        int row = adapter.appendRow(List.of("R20250607091500-001", "2025-06-04 10:00:00", 52000L));

        // then
        assertThat(row).isEqualTo(7);
        verify(postRequestedFor(urlPathMatching(VALUES_URL + ":append"))
                .withQueryParam("valueInputOption", equalTo("USER_ENTERED"))
                .withQueryParam("insertDataOption", equalTo("INSERT_ROWS"))
                .withHeader("Authorization", equalTo("Bearer test-token"))
                .withRequestBody(matchingJsonPath("$.values[0][0]", equalTo("R20250607091500-001")))
                .withRequestBody(matchingJsonPath("$.values[0][2]", equalTo("52000"))));
    }

    @Test
    @DisplayName("행 추가 실패 - 재시도 없이 1회만 요청")
    void appendRow_ServerError() {
        // given
        stubFor(post(urlPathMatching(VALUES_URL + ":append")).willReturn(serviceUnavailable()));

        // when & then
        assertThatThrownBy(() -> adapter.appendRow(List.of("R1")))
                .isInstanceOf(ExternalStoreException.class);
        verify(1, postRequestedFor(urlPathMatching(VALUES_URL + ":append")));
    }

    @Test
    @DisplayName("행 읽기 - 헤더 다음 행부터 문자열로 반환")
    void readRows() {
        // given
        stubFor(get(urlPathMatching(VALUES_URL))
                .willReturn(okJson("""
                        {"range": "Ledger!A2:Q3", "values": [["R1", "2025-06-04 10:00:00", "2025-06-07"], ["R2", "", "2025-06-08", "日", "09:00"]]}
                        """)));

        // when
        List<List<String>> rows = adapter.readRows();

        // then
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsExactly("R1", "2025-06-04 10:00:00", "2025-06-07");
        assertThat(rows.get(1)).hasSize(5);
    }

    @Test
    @DisplayName("행 읽기 - values가 없으면 빈 목록")
    void readRows_Empty() {
        // given
        stubFor(get(urlPathMatching(VALUES_URL)).willReturn(okJson("{\"range\": \"Ledger!A2:Q1000\"}")));

        // when & then
        assertThat(adapter.readRows()).isEmpty();
    }

    @Test
    @DisplayName("헤더 - 비어 있으면 RAW로 기록")
    void ensureHeaderRow_Writes() {
        // given
        stubFor(get(urlPathMatching(VALUES_URL)).willReturn(okJson("{\"range\": \"Ledger!A1:Q1\"}")));
        stubFor(put(urlPathMatching(VALUES_URL)).willReturn(okJson("{\"updatedCells\": 17}")));

        // when
        adapter.ensureHeaderRow(BookingLedgerCodec.HEADERS);

        // then
        verify(putRequestedFor(urlPathMatching(VALUES_URL))
                .withQueryParam("valueInputOption", equalTo("RAW"))
                .withRequestBody(matchingJsonPath("$.values[0][0]", equalTo("予約ID")))
                .withRequestBody(matchingJsonPath("$.values[0][16]", equalTo("備考"))));
    }

    @Test
    @DisplayName("헤더 - 이미 있으면 기록하지 않음")
    void ensureHeaderRow_AlreadyPresent() {
        // given
        stubFor(get(urlPathMatching(VALUES_URL))
                .willReturn(okJson("{\"values\": [[\"予約ID\", \"受付日時\"]]}")));

        // when
        adapter.ensureHeaderRow(BookingLedgerCodec.HEADERS);

        // then
        verify(0, putRequestedFor(urlPathMatching(VALUES_URL)));
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Ledger!A7:Q7|7",
            "'予約台帳'!A12:Q12|12",
            "Sheet1!A100|100"
    })
    @DisplayName("updatedRange 행 번호 파싱")
    void parseRowNumber(String updatedRange, int expected) {
        assertThat(GoogleSheetsRestClientAdapter.parseRowNumber(updatedRange)).isEqualTo(expected);
    }

    @Test
    @DisplayName("updatedRange가 없거나 형식이 틀리면 예외")
    void parseRowNumber_Invalid() {
        assertThatThrownBy(() -> GoogleSheetsRestClientAdapter.parseRowNumber(null))
                .isInstanceOf(ExternalStoreException.class);
        assertThatThrownBy(() -> GoogleSheetsRestClientAdapter.parseRowNumber("Ledger!A:Q"))
                .isInstanceOf(ExternalStoreException.class);
    }
}

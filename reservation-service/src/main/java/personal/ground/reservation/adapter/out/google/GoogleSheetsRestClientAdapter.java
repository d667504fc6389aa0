package personal.ground.reservation.adapter.out.google;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ground.common.exception.ErrorCode;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.application.port.out.LedgerStore;
import personal.ground.reservation.domain.exception.ExternalStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Sheets REST Client Adapter
 * Sheets API v4 (values.get / values.update / values.append)
 *
 * 추가된 행 번호는 응답의 updates.updatedRange (예: 予約台帳!A5:Q5) 에서 추출
 */
@Slf4j
@Component
public class GoogleSheetsRestClientAdapter implements LedgerStore {

    private static final String VALUES_PATH = "/spreadsheets/{spreadsheetId}/values/{range}";
    private static final String APPEND_PATH = "/spreadsheets/{spreadsheetId}/values/{range}:append";

    private final RestClient restClient;
    private final String spreadsheetId;
    private final String sheetName;

    public GoogleSheetsRestClientAdapter(@Qualifier("googleSheetsRestClient") RestClient restClient,
                                         ExternalApiProperties properties) {
        this.restClient = restClient;
        this.spreadsheetId = properties.google().spreadsheetId();
        this.sheetName = properties.google().sheetName();
    }

    @Override
    @CircuitBreaker(name = "googleSheets", fallbackMethod = "ensureHeaderRowFallback")
    public void ensureHeaderRow(List<String> columns) {
        JsonNode header = restClient.get()
                .uri(VALUES_PATH, spreadsheetId, sheetName + "!A1:Q1")
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                            "values.get (header) failed: status=" + response.getStatusCode());
                })
                .body(JsonNode.class);

        if (header != null && header.has("values") && !header.get("values").isEmpty()) {
            log.debug("Ledger header already present: sheet={}", sheetName);
            return;
        }

        restClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path(VALUES_PATH)
                        .queryParam("valueInputOption", "RAW")
                        .build(spreadsheetId, sheetName + "!A1"))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("values", List.of(columns)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                            "values.update (header) failed: status=" + response.getStatusCode());
                })
                .toBodilessEntity();

        log.info("Ledger header written: sheet={}, columns={}", sheetName, columns.size());
    }

    /**
     * 행 추가. 중복 행 방지를 위해 재시도하지 않음
     */
    @Override
    @CircuitBreaker(name = "googleSheets", fallbackMethod = "appendRowFallback")
    public int appendRow(List<Object> columns) {
        JsonNode result = restClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path(APPEND_PATH)
                        .queryParam("valueInputOption", "USER_ENTERED")
                        .queryParam("insertDataOption", "INSERT_ROWS")
                        .build(spreadsheetId, sheetName + "!A1"))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("values", List.of(columns)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                            "values.append failed: status=" + response.getStatusCode());
                })
                .body(JsonNode.class);

        String updatedRange = result == null ? null : result.path("updates").path("updatedRange").asText(null);
        return parseRowNumber(updatedRange);
    }

    @Override
    @CircuitBreaker(name = "googleSheets", fallbackMethod = "readRowsFallback")
    @Retry(name = "googleSheetsRead")
    public List<List<String>> readRows() {
        JsonNode body = restClient.get()
                .uri(VALUES_PATH, spreadsheetId, sheetName + "!A2:Q")
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                            "values.get failed: status=" + response.getStatusCode());
                })
                .body(JsonNode.class);

        List<List<String>> rows = new ArrayList<>();
        if (body == null || !body.has("values")) {
            return rows;
        }
        for (JsonNode rowNode : body.get("values")) {
            List<String> row = new ArrayList<>();
            rowNode.forEach(cell -> row.add(cell.asText()));
            rows.add(row);
        }
        log.debug("Ledger rows read: sheet={}, rows={}", sheetName, rows.size());
        return rows;
    }

    private void ensureHeaderRowFallback(List<String> columns, Exception e) {
        log.error("Ledger header check unavailable: sheet={}, error={}", sheetName, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.ledger("header check unavailable", e);
    }

    private int appendRowFallback(List<Object> columns, Exception e) {
        log.error("Ledger append unavailable: sheet={}, error={}", sheetName, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.ledger("values.append unavailable", e);
    }

    private List<List<String>> readRowsFallback(Exception e) {
        log.error("Ledger read unavailable: sheet={}, error={}", sheetName, e.getClass().getSimpleName(), e);
        throw ExternalStoreException.ledger("values.get unavailable", e);
    }

    /**
     * "'予約台帳'!A5:Q5" → 5
     */
    static int parseRowNumber(String updatedRange) {
        if (updatedRange == null || !updatedRange.contains("!")) {
            throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                    "values.append returned no updatedRange: " + updatedRange);
        }
        String firstCell = updatedRange.substring(updatedRange.lastIndexOf('!') + 1).split(":")[0];
        String digits = firstCell.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            throw new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR,
                    "Unparseable updatedRange: " + updatedRange);
        }
        return Integer.parseInt(digits);
    }
}

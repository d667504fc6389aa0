package personal.ground.reservation.adapter.out;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.ground.reservation.application.config.ExternalApiProperties;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * 외부 API별 RestClient. 모든 클라이언트에 connect/read 타임아웃을 둔다
 *
 * Timeout 기본값:
 * - Connect Timeout (2000ms)
 * - Read Timeout: Google/Discord 5000ms, Anthropic 30000ms (이미지 추출 응답이 느림)
 */
@Configuration
public class RestClientConfig {

    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 2000;
    private static final int DEFAULT_READ_TIMEOUT_MS = 5000;
    private static final int DEFAULT_EXTRACTOR_READ_TIMEOUT_MS = 30000;

    @Bean
    public RestClient googleCalendarRestClient(ExternalApiProperties properties) {
        ExternalApiProperties.Google google = properties.google();
        return RestClient.builder()
                .baseUrl(google.calendarBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + google.accessToken())
                .requestFactory(requestFactory(google.timeout(), DEFAULT_READ_TIMEOUT_MS))
                .build();
    }

    @Bean
    public RestClient googleSheetsRestClient(ExternalApiProperties properties) {
        ExternalApiProperties.Google google = properties.google();
        return RestClient.builder()
                .baseUrl(google.sheetsBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + google.accessToken())
                .requestFactory(requestFactory(google.timeout(), DEFAULT_READ_TIMEOUT_MS))
                .build();
    }

    /**
     * Webhook URL 전체를 요청 URI로 사용하므로 baseUrl 없음
     */
    @Bean
    public RestClient discordRestClient(ExternalApiProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(properties.discord().timeout(), DEFAULT_READ_TIMEOUT_MS))
                .build();
    }

    @Bean
    public RestClient anthropicRestClient(ExternalApiProperties properties) {
        ExternalApiProperties.Anthropic anthropic = properties.anthropic();
        return RestClient.builder()
                .baseUrl(anthropic.baseUrl())
                .defaultHeader("x-api-key", anthropic.apiKey() == null ? "" : anthropic.apiKey())
                .defaultHeader("anthropic-version", anthropic.apiVersion())
                .requestFactory(requestFactory(anthropic.timeout(), DEFAULT_EXTRACTOR_READ_TIMEOUT_MS))
                .build();
    }

    static JdkClientHttpRequestFactory requestFactory(ExternalApiProperties.Timeout timeout, int defaultReadMs) {
        int connectMs = timeout != null && timeout.connectMs() > 0 ? timeout.connectMs() : DEFAULT_CONNECT_TIMEOUT_MS;
        int readMs = timeout != null && timeout.readMs() > 0 ? timeout.readMs() : defaultReadMs;

        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readMs));
        return requestFactory;
    }
}

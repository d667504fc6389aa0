package personal.ground.reservation.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 외부 연동 설정 Properties
 * 자격 증명은 환경변수로 주입 (application.yml 참조)
 */
@ConfigurationProperties(prefix = "external")
public record ExternalApiProperties(
        Google google,
        Discord discord,
        Anthropic anthropic
) {
    public record Google(
            String accessToken,
            String calendarBaseUrl,
            String calendarId,
            String sheetsBaseUrl,
            String spreadsheetId,
            String sheetName,
            Timeout timeout
    ) {
    }

    public record Discord(
            String webhookUrl,
            boolean enabled,
            Timeout timeout
    ) {
        public boolean isActive() {
            return enabled && webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    public record Anthropic(
            String baseUrl,
            String apiKey,
            String model,
            String apiVersion,
            int maxTokens,
            Timeout timeout
    ) {
    }

    public record Timeout(
            int connectMs,
            int readMs
    ) {
    }
}

package personal.ground.reservation.adapter.out.discord;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ground.common.exception.ErrorCode;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.application.port.out.NotificationSink;
import personal.ground.reservation.domain.exception.ExternalStoreException;
import personal.ground.reservation.domain.model.NotificationMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discord Webhook Adapter
 * 운영자 알림을 Discord embed로 전송. Webhook URL 미설정 시 no-op
 */
@Slf4j
@Component
public class DiscordWebhookAdapter implements NotificationSink {

    private final RestClient restClient;
    private final ExternalApiProperties.Discord discord;

    public DiscordWebhookAdapter(@Qualifier("discordRestClient") RestClient restClient,
                                 ExternalApiProperties properties) {
        this.restClient = restClient;
        this.discord = properties.discord();
    }

    @Override
    @CircuitBreaker(name = "discord", fallbackMethod = "sendFallback")
    public void send(NotificationMessage message) {
        if (!discord.isActive()) {
            log.debug("Discord notification disabled, skipping: kind={}", message.kind());
            return;
        }

        restClient.post()
                .uri(discord.webhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("embeds", List.of(toEmbed(message))))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new ExternalStoreException(ErrorCode.NOTIFICATION_ERROR,
                            "Discord webhook failed: status=" + response.getStatusCode());
                })
                .toBodilessEntity();

        log.debug("Discord notification sent: kind={}", message.kind());
    }

    private void sendFallback(NotificationMessage message, Exception e) {
        log.error("Discord webhook unavailable: kind={}, error={}", message.kind(), e.getClass().getSimpleName(), e);
        throw ExternalStoreException.notification("Discord webhook unavailable", e);
    }

    static Map<String, Object> toEmbed(NotificationMessage message) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", message.title());
        embed.put("color", colorOf(message.kind()));
        if (message.description() != null) {
            embed.put("description", message.description());
        }
        if (!message.fields().isEmpty()) {
            List<Map<String, Object>> fields = new ArrayList<>();
            for (NotificationMessage.Field field : message.fields()) {
                fields.add(Map.of("name", field.name(), "value", field.value(), "inline", field.inline()));
            }
            embed.put("fields", fields);
        }
        if (message.footer() != null) {
            embed.put("footer", Map.of("text", message.footer()));
        }
        return embed;
    }

    static int colorOf(NotificationMessage.Kind kind) {
        return switch (kind) {
            case NEW_RESERVATION -> 0x2ECC71;
            case CONFLICT -> 0xF39C12;
            case CANCEL_REQUEST, RECONCILIATION_REQUIRED -> 0xE74C3C;
            case DAILY_SUMMARY -> 0x3498DB;
        };
    }
}

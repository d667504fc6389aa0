package personal.ground.reservation.adapter.out.anthropic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ground.reservation.application.config.ExternalApiProperties;
import personal.ground.reservation.application.config.GroundProperties;
import personal.ground.reservation.application.port.out.ReservationExtractor;
import personal.ground.reservation.domain.model.Category;
import personal.ground.reservation.domain.model.Court;
import personal.ground.reservation.domain.model.ExtractionResult;
import personal.ground.reservation.domain.model.ReservationCandidate;
import personal.ground.reservation.domain.service.BookingLedgerCodec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Anthropic Extractor Adapter
 * Messages API로 자연어/이미지에서 예약 후보를 추출한다.
 *
 * 추출기는 신뢰할 수 없는 입력원: 호출 실패, JSON 파싱 실패 모두 "예약 아님"으로 반환하고 예외를 던지지 않는다.
 * 시간 반올림, 종료 시각 계산 등은 코어(RequestNormalizer)에서 수행
 */
@Slf4j
@Component
public class AnthropicExtractorAdapter implements ReservationExtractor {

    private static final String MESSAGES_PATH = "/v1/messages";
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ExternalApiProperties.Anthropic anthropic;
    private final String systemPrompt;

    public AnthropicExtractorAdapter(@Qualifier("anthropicRestClient") RestClient restClient,
                                     ObjectMapper objectMapper,
                                     ExternalApiProperties externalApiProperties,
                                     GroundProperties groundProperties) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.anthropic = externalApiProperties.anthropic();
        this.systemPrompt = buildSystemPrompt(groundProperties);
    }

    @Override
    public ExtractionResult extractFromText(String text, LocalDate today) {
        String content = String.format("今日の日付: %s（%s）%n%nメッセージ: %s",
                today, BookingLedgerCodec.dayOfWeekLabel(today), text);
        return extract(List.of(Map.of("role", "user", "content", content)), "text");
    }

    @Override
    public ExtractionResult extractFromImage(byte[] image, String mediaType, LocalDate today) {
        if (image == null || image.length == 0) {
            return ExtractionResult.failed("empty image");
        }
        String resolvedMediaType = mediaType == null || mediaType.isBlank() ? MediaType.IMAGE_JPEG_VALUE : mediaType;

        List<Map<String, Object>> content = List.of(
                Map.of("type", "image",
                        "source", Map.of(
                                "type", "base64",
                                "media_type", resolvedMediaType,
                                "data", Base64.getEncoder().encodeToString(image))),
                Map.of("type", "text",
                        "text", String.format("今日の日付: %s%n%nこの画像から予約情報を抽出してください。", today)));
        return extract(List.of(Map.of("role", "user", "content", content)), "image");
    }

    private ExtractionResult extract(List<Map<String, Object>> messages, String source) {
        String responseText;
        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("model", anthropic.model());
            request.put("max_tokens", anthropic.maxTokens());
            request.put("system", systemPrompt);
            request.put("messages", messages);

            JsonNode response = restClient.post()
                    .uri(MESSAGES_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);

            responseText = response == null ? "" : response.path("content").path(0).path("text").asText("");
        } catch (Exception e) {
            log.error("Extractor call failed: source={}, error={}", source, e.getClass().getSimpleName(), e);
            return ExtractionResult.failed(e.getClass().getSimpleName());
        }
        return parseResponse(responseText, source);
    }

    ExtractionResult parseResponse(String responseText, String source) {
        String json = CODE_FENCE.matcher(responseText).replaceAll("").trim();
        try {
            JsonNode data = objectMapper.readTree(json);
            if (data == null || !data.path("is_reservation").asBoolean(false)) {
                log.debug("Extractor classified message as non-reservation: source={}", source);
                return ExtractionResult.notReservation();
            }
            ReservationCandidate candidate = toCandidate(data);
            log.info("Reservation candidate extracted: source={}, date={}, start={}, confidence={}",
                    source, candidate.date(), candidate.startTime(), candidate.confidence());
            return ExtractionResult.reservation(candidate);

        } catch (JsonProcessingException e) {
            log.warn("Extractor returned unparseable output: source={}, head={}",
                    source, json.substring(0, Math.min(200, json.length())));
            return ExtractionResult.failed("JSON parse error");
        }
    }

    private ReservationCandidate toCandidate(JsonNode data) {
        return new ReservationCandidate(
                text(data, "date"),
                text(data, "start_time"),
                text(data, "end_time"),
                data.hasNonNull("hours") && data.get("hours").canConvertToInt() ? data.get("hours").asInt() : null,
                text(data, "court"),
                text(data, "category"),
                data.hasNonNull("is_weekend") ? data.get("is_weekend").asBoolean() : null,
                text(data, "name"),
                text(data, "phone"),
                notes(data),
                data.hasNonNull("confidence") ? data.get("confidence").asDouble() : null);
    }

    /**
     * 대장에 별도 컬럼이 없는 항목(팀명, 인원, 메일)은 비고에 합친다
     */
    private String notes(JsonNode data) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, "チーム", text(data, "team_name"));
        addIfPresent(parts, "人数", text(data, "num_people"));
        addIfPresent(parts, "メール", text(data, "email"));
        String notes = text(data, "notes");
        if (notes != null) {
            parts.add(notes);
        }
        return parts.isEmpty() ? null : String.join(" / ", parts);
    }

    private static void addIfPresent(List<String> parts, String label, String value) {
        if (value != null) {
            parts.add(label + "：" + value);
        }
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    static String buildSystemPrompt(GroundProperties properties) {
        String courts = properties.courtList().stream().map(Court::id).collect(Collectors.joining(" / "));
        String courtChoices = properties.courtList().stream()
                .map(court -> "\"" + court.id() + "\"")
                .collect(Collectors.joining(" or "));
        String categoryKeys = properties.categoryList().stream()
                .map(category -> "\"" + category.key() + "\"")
                .collect(Collectors.joining(" or "));
        String rates = properties.categoryList().stream()
                .map(category -> String.format(Locale.JAPAN, "- %s: 平日%,d円/h、土日祝%,d円/h",
                        category.label(), category.weekdayRate(), category.weekendRate()))
                .collect(Collectors.joining("\n"));
        int unitHours = properties.pricing().unitHours();
        int minHours = properties.pricing().minBookingHours();
        Category defaultCategory = properties.categoryList().stream()
                .filter(category -> category.key().equals(properties.pricing().defaultCategory()))
                .findFirst()
                .orElseThrow();

        return "あなたは" + properties.name() + "の予約管理AIです。\n"
                + "ユーザーのメッセージや画像から予約情報を抽出してください。\n\n"
                + "【グラウンド情報】\n"
                + "コート種類: " + courts + "\n"
                + "予約単位: " + unitHours + "時間単位\n"
                + "営業時間: " + properties.businessHours().open() + "〜" + properties.businessHours().close() + "\n\n"
                + "【料金体系】\n"
                + "利用者区分:\n" + rates + "\n\n"
                + "以下のJSON形式のみで返答してください（余計なテキスト不要）：\n"
                + "{\n"
                + "  \"is_reservation\": true/false,\n"
                + "  \"date\": \"YYYY-MM-DD\",\n"
                + "  \"start_time\": \"HH:MM\",\n"
                + "  \"end_time\": \"HH:MM\",\n"
                + "  \"hours\": " + minHours + ",\n"
                + "  \"court\": " + courtChoices + ",\n"
                + "  \"category\": " + categoryKeys + ",\n"
                + "  \"is_weekend\": true/false,\n"
                + "  \"name\": \"氏名\",\n"
                + "  \"phone\": \"電話番号\",\n"
                + "  \"email\": \"メールアドレス\",\n"
                + "  \"team_name\": \"チーム名（あれば）\",\n"
                + "  \"num_people\": 人数（数字）,\n"
                + "  \"notes\": \"その他の要望\",\n"
                + "  \"confidence\": 0.0〜1.0\n"
                + "}\n\n"
                + "ルール：\n"
                + "- is_reservation: 予約・使用希望ならtrue、雑談・問い合わせはfalse\n"
                + "- date: 今日を基準に具体的な日付に変換\n"
                + "- court: 記載なければ\"" + properties.resolveDefaultCourt().id() + "\"\n"
                + "- category: 記載なければ\"" + defaultCategory.key() + "\"\n"
                + "- is_weekend: 土日祝ならtrue\n"
                + "- 不明な項目はnullにする\n"
                + "- confidence: 日時・氏名がそろっていれば0.9以上";
    }
}

package personal.ground.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 텍스트 메시지 요청 DTO (메시징 게이트웨이 → 서비스)
 */
public record MessageRequest(
        @NotBlank(message = "メッセージを入力してください。")
        String text
) {
}

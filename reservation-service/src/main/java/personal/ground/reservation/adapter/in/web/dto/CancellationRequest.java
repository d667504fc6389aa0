package personal.ground.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 취소 신청 요청 DTO
 */
public record CancellationRequest(
        @NotBlank(message = "キャンセル内容を入力してください。")
        String text
) {
}

package personal.ground.reservation.adapter.in.web.dto;

/**
 * 회신 문구 응답 DTO
 *
 * @param reply 이용자에게 그대로 전달할 문구
 */
public record ReplyResponse(
        String reply
) {
}

package personal.ground.reservation.domain.model;

/**
 * Court (그라운드 면)
 *
 * @param id      캘린더 제목/대장에 기록되는 식별 텍스트 (예: 人工芝)
 * @param name    표시용 이름
 * @param colorId 캘린더 이벤트 색상 ID
 */
public record Court(
        String id,
        String name,
        String colorId
) {
    public Court {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Court id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
    }

    public boolean matches(String text) {
        return id.equals(text) || name.equals(text);
    }
}

package personal.ground.reservation.adapter.in.web.dto;

/**
 * Health Check 응답 데이터
 *
 * @param lockStrategy 면 락 전략 (none | local | redis)
 * @param redis        Redis 상태 ("UP" | "DOWN" | "NOT_USED")
 * @param calendar     캘린더 연동 설정 여부 ("CONFIGURED" | "DISABLED")
 * @param ledger       대장 연동 설정 여부
 * @param notification 알림 연동 설정 여부
 * @param extractor    추출기 연동 설정 여부
 */
public record HealthCheckResponse(
        String lockStrategy,
        String redis,
        String calendar,
        String ledger,
        String notification,
        String extractor
) {
}

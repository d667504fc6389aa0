package personal.ground.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 사용자 노출 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "入力内容に誤りがあります。"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "指定されたリソースが見つかりません。"),
    CONFLICT(HttpStatus.CONFLICT, "C003", "リソースの競合が発生しました。"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C004",
            "システムエラーが発生しました。お手数ですが直接ご連絡ください。"),

    // Reservation Domain (Rxxx)
    RESERVATION_VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "R001", "予約情報が不足しています。"),
    RESERVATION_CONFLICT(HttpStatus.CONFLICT, "R002", "指定の日時はすでに予約が入っております。"),
    COURT_LOCK_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "R003",
            "ただいま予約が混み合っています。しばらくしてから再度お試しください。"),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "外部サービスでエラーが発生しました。"),
    EXTERNAL_SERVICE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E002", "外部サービスの応答がタイムアウトしました。"),
    CALENDAR_STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E003", "カレンダーへの登録に失敗しました。"),
    LEDGER_STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E004", "予約台帳への記録に失敗しました。"),
    NOTIFICATION_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E005", "通知の送信に失敗しました。");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

package personal.ground.reservation.domain.exception;

import personal.ground.common.exception.BusinessException;
import personal.ground.common.exception.ErrorCode;

/**
 * External Store Exception
 * 캘린더/대장/알림 등 외부 스토어 호출 실패 시 발생.
 * 상세 메시지는 로그 전용이며 사용자에게는 ErrorCode의 일반 메시지만 노출
 */
public class ExternalStoreException extends BusinessException {

    public ExternalStoreException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public ExternalStoreException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }

    public static ExternalStoreException calendar(String detail, Throwable cause) {
        return new ExternalStoreException(ErrorCode.CALENDAR_STORE_ERROR, detail, cause);
    }

    public static ExternalStoreException ledger(String detail, Throwable cause) {
        return new ExternalStoreException(ErrorCode.LEDGER_STORE_ERROR, detail, cause);
    }

    public static ExternalStoreException notification(String detail, Throwable cause) {
        return new ExternalStoreException(ErrorCode.NOTIFICATION_ERROR, detail, cause);
    }
}

package personal.ground.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 최상위 클래스
 * ErrorCode와 내부 상세 메시지를 함께 보관 (상세 메시지는 로그 전용)
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}

package com.ryuqq.repoup.core.error;

/**
 * 저장소 업데이트 엔진의 모든 오류의 상위 타입.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class RepoupException extends RuntimeException {

    private final ErrorCode errorCode;

    public RepoupException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public RepoupException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}

package com.ryuqq.repoup.core.error;

/**
 * 호출자가 지정한 deadline이 지난 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class UpdateTimeoutException extends RepoupException {

    public UpdateTimeoutException(String message) {
        super(ErrorCode.TIMEOUT, message);
    }

    public UpdateTimeoutException(String message, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, cause);
    }
}

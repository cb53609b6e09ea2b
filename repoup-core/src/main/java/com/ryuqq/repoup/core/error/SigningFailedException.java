package com.ryuqq.repoup.core.error;

/**
 * 외부 서명 도구 또는 키링 준비가 실패한 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class SigningFailedException extends RepoupException {

    public SigningFailedException(String message) {
        super(ErrorCode.SIGNING_FAILED, message);
    }

    public SigningFailedException(String message, Throwable cause) {
        super(ErrorCode.SIGNING_FAILED, message, cause);
    }
}

package com.ryuqq.repoup.core.error;

/**
 * 서명 직후 검증이 실패한 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class VerificationFailedException extends RepoupException {

    public VerificationFailedException(String message) {
        super(ErrorCode.VERIFICATION_FAILED, message);
    }

    public VerificationFailedException(String message, Throwable cause) {
        super(ErrorCode.VERIFICATION_FAILED, message, cause);
    }
}

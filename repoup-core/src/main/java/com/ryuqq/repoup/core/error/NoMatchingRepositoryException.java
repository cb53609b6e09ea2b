package com.ryuqq.repoup.core.error;

/**
 * 어떤 라우팅 규칙도 패키지와 일치하지 않는 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class NoMatchingRepositoryException extends RepoupException {

    public NoMatchingRepositoryException(String message) {
        super(ErrorCode.NO_MATCHING_REPOSITORY, message);
    }

    public NoMatchingRepositoryException(String message, Throwable cause) {
        super(ErrorCode.NO_MATCHING_REPOSITORY, message, cause);
    }
}

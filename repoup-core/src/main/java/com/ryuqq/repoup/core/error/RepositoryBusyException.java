package com.ryuqq.repoup.core.error;

/**
 * 재시도 한도 내에 저장소 lease를 얻지 못했거나, lease를 잃었거나, 매니페스트 조건부 쓰기 경쟁에서 진 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class RepositoryBusyException extends RepoupException {

    public RepositoryBusyException(String message) {
        super(ErrorCode.REPOSITORY_BUSY, message);
    }

    public RepositoryBusyException(String message, Throwable cause) {
        super(ErrorCode.REPOSITORY_BUSY, message, cause);
    }
}

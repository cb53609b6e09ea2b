package com.ryuqq.repoup.core.error;

/**
 * 조건부 쓰기의 전제 조건이 현재 오브젝트 상태와 맞지 않는 경우.
 *
 * <p>낙관적 잠금 경쟁에서 진 것을 의미합니다. 잠금 관리자는 이 예외를 제한된 횟수만큼
 * 내부적으로 재시도하고, 한도를 넘으면 {@link RepositoryBusyException}으로 변환합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class PreconditionFailedException extends RepoupException {

    private final String key;

    public PreconditionFailedException(String key, String message) {
        super(ErrorCode.PRECONDITION_FAILED, message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

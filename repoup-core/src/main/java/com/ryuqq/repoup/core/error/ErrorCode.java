package com.ryuqq.repoup.core.error;

/**
 * 엔진 오류 분류.
 *
 * <p>retryable 오류는 엔진 내부에서 제한된 횟수만큼 재시도된 뒤에만 호출자에게 노출됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /** 패키지 파일 이름/헤더에서 필수 필드를 얻을 수 없음. */
    MALFORMED_PACKAGE(false),

    /** 라우팅 규칙 중 일치하는 저장소가 없음. */
    NO_MATCHING_REPOSITORY(false),

    /** lease 경합으로 제한 시간 내 잠금 획득 실패, 또는 낙관적 잠금 경쟁에서 패배. */
    REPOSITORY_BUSY(false),

    /** 호출자 deadline 초과. */
    TIMEOUT(false),

    /** 외부 인덱스 생성 실패. */
    METADATA_BUILD_FAILED(false),

    /** 외부 서명 도구 실패. */
    SIGNING_FAILED(false),

    /** 서명 검증 실패. */
    VERIFICATION_FAILED(false),

    /** 일시적 스토리지 I/O 오류. */
    STORAGE_ERROR(true),

    /** 조건부 쓰기의 전제 조건 불일치. */
    PRECONDITION_FAILED(true),

    /** 오브젝트 없음. */
    OBJECT_NOT_FOUND(false),

    /** 같은 패키지 신원이 다른 콘텐츠로 이미 존재함. */
    PACKAGE_CONFLICT(false),

    /** 삭제 대상 콘텐츠 해시를 어떤 저장소에서도 찾을 수 없음. */
    PACKAGE_NOT_FOUND(false),

    /** 패키지 포맷이 저장소 포맷과 다름. */
    FORMAT_MISMATCH(false),

    /** 같은 호출의 다른 항목이 RESOLVING에서 실패하여 전체 배치가 중단됨. */
    BATCH_ABORTED(false),

    /** 분류되지 않은 내부 오류. */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

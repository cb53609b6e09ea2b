package com.ryuqq.repoup.core.error;

/**
 * 외부 인덱스 생성기가 실패한 경우. 라이브 매니페스트는 변경되지 않습니다.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class MetadataBuildFailedException extends RepoupException {

    public MetadataBuildFailedException(String message) {
        super(ErrorCode.METADATA_BUILD_FAILED, message);
    }

    public MetadataBuildFailedException(String message, Throwable cause) {
        super(ErrorCode.METADATA_BUILD_FAILED, message, cause);
    }
}

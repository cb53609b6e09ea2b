package com.ryuqq.repoup.core.error;

/**
 * 패키지 파일 이름 또는 헤더에서 아키텍처, 이름 등 필수 필드를 결정할 수 없는 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class MalformedPackageException extends RepoupException {

    public MalformedPackageException(String message) {
        super(ErrorCode.MALFORMED_PACKAGE, message);
    }

    public MalformedPackageException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_PACKAGE, message, cause);
    }
}

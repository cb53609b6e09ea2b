package com.ryuqq.repoup.core.error;

/**
 * 일시적인 오브젝트 스토리지 I/O 오류. 백오프와 함께 재시도됩니다.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class StorageException extends RepoupException {

    public StorageException(String message) {
        super(ErrorCode.STORAGE_ERROR, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}

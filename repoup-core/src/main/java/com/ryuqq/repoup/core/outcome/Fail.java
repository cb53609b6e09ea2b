package com.ryuqq.repoup.core.outcome;

import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.error.RepoupException;

/**
 * 실패 결과.
 *
 * <p>리포트 항목 하나의 실패를 나타냅니다. 배치의 다른 항목 결과에는 영향을 주지 않습니다.</p>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record Fail(
    ErrorCode errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode가 null이거나 message가 null/빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorCode errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * <p>RepoupException이 아닌 예외는 INTERNAL_ERROR로 분류됩니다.</p>
     *
     * @param exception 실패 원인 예외
     * @return Fail 인스턴스
     */
    public static Fail from(Throwable exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        ErrorCode code = exception instanceof RepoupException repoup ? repoup.getErrorCode() : ErrorCode.INTERNAL_ERROR;
        String message = exception.getMessage() == null || exception.getMessage().isBlank()
            ? exception.getClass().getSimpleName()
            : exception.getMessage();
        Throwable cause = exception.getCause();
        return new Fail(code, message, cause == null ? null : String.valueOf(cause.getMessage()));
    }
}

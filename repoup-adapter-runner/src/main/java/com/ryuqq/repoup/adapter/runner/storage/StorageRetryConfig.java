package com.ryuqq.repoup.adapter.runner.storage;

import com.ryuqq.repoup.adapter.runner.BackoffCalculator;

/**
 * 일시적 스토리지 오류 재시도 설정 (불변 record).
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param maxAttempts 총 시도 횟수 (1 이상, 1이면 재시도 없음)
 * @param baseDelayMs 첫 재시도 대기 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 재시도 대기 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 */
public record StorageRetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=100, maxDelayMs=2000, jitterFactor=0.2</p>
     */
    public StorageRetryConfig() {
        this(3, 100, 2000, 0.2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StorageRetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public StorageRetryConfig withMaxAttempts(int maxAttempts) {
        return new StorageRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 대기 시간 범위만 변경한 새 인스턴스 생성.
     */
    public StorageRetryConfig withDelays(long baseDelayMs, long maxDelayMs) {
        return new StorageRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}

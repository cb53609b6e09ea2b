package com.ryuqq.repoup.adapter.runner;

import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>lease 경합 재시도와 일시적 스토리지 오류 재시도의 대기 시간을 계산합니다.
 * 여러 호출(예: 서버리스 함수 인스턴스)이 같은 저장소 lock을 동시에 재시도하지 않도록
 * 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (lock 기본값 baseDelay=200ms, maxDelay=5000ms, jitterFactor=0.5):</strong></p>
 * <ul>
 *   <li>attempt=1: 200ms + jitter(0-100ms)</li>
 *   <li>attempt=3: 800ms + jitter(0-400ms)</li>
 *   <li>attempt=6: 6400ms → 5000ms (maxDelay)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, Math::random);
    }

    /**
     * 난수 공급자를 주입하여 생성 (테스트에서 jitter 고정용).
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
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
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // 2^62 이상은 overflow이므로 shift 횟수를 제한
        int shift = Math.min(attempt - 1, 62);
        long exponential = baseDelayMs > (Long.MAX_VALUE >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}

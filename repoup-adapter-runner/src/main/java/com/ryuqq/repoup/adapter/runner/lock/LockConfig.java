package com.ryuqq.repoup.adapter.runner.lock;

import com.ryuqq.repoup.adapter.runner.BackoffCalculator;

import java.time.Duration;

/**
 * LeaseLockManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>leaseDuration: lease 유효 시간 (기본 60초). 절반이 지나면 단계 사이에서 갱신</li>
 *   <li>maxAttempts: 획득 시도 최대 횟수 (기본 10). 초과 시 RepositoryBusy</li>
 *   <li>baseBackoff / maxBackoff: 경합 시 재시도 간격 (기본 200ms ~ 5초)</li>
 *   <li>jitterFactor: 재시도 간격 jitter 비율 (기본 0.5)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>긴 메타데이터 생성: leaseDuration 증가 (생성 단계는 갱신 지점 사이에 있음)</li>
 *   <li>빠른 실패: maxAttempts 감소</li>
 *   <li>호출자 간 시계 오차가 큰 환경: leaseDuration을 오차보다 충분히 크게</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param leaseDuration lease 유효 시간 (양수)
 * @param maxAttempts 획득 시도 최대 횟수 (1 이상)
 * @param baseBackoff 첫 재시도 대기 시간 (양수)
 * @param maxBackoff 최대 재시도 대기 시간 (baseBackoff 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 */
public record LockConfig(
    Duration leaseDuration,
    int maxAttempts,
    Duration baseBackoff,
    Duration maxBackoff,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: leaseDuration=60s, maxAttempts=10, baseBackoff=200ms, maxBackoff=5s, jitterFactor=0.5</p>
     */
    public LockConfig() {
        this(Duration.ofSeconds(60), 10, Duration.ofMillis(200), Duration.ofSeconds(5), 0.5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LockConfig {
        if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException(
                "leaseDuration must be positive (current: " + leaseDuration + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoff == null || baseBackoff.isNegative() || baseBackoff.isZero()) {
            throw new IllegalArgumentException(
                "baseBackoff must be positive (current: " + baseBackoff + ")"
            );
        }
        if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException(
                "maxBackoff must be >= baseBackoff (base: " + baseBackoff + ", max: " + maxBackoff + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 경합 재시도용 BackoffCalculator 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseBackoff.toMillis(), maxBackoff.toMillis(), jitterFactor);
    }

    /**
     * leaseDuration만 변경한 새 인스턴스 생성.
     */
    public LockConfig withLeaseDuration(Duration leaseDuration) {
        return new LockConfig(leaseDuration, maxAttempts, baseBackoff, maxBackoff, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public LockConfig withMaxAttempts(int maxAttempts) {
        return new LockConfig(leaseDuration, maxAttempts, baseBackoff, maxBackoff, jitterFactor);
    }

    /**
     * backoff 범위만 변경한 새 인스턴스 생성.
     */
    public LockConfig withBackoff(Duration baseBackoff, Duration maxBackoff) {
        return new LockConfig(leaseDuration, maxAttempts, baseBackoff, maxBackoff, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public LockConfig withJitterFactor(double jitterFactor) {
        return new LockConfig(leaseDuration, maxAttempts, baseBackoff, maxBackoff, jitterFactor);
    }
}

package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.core.error.UpdateTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 호출자 deadline.
 *
 * <p>LOCKING 중 만료되면 스토리지 변경 없이 실패하고, STAGING 이후 만료되면
 * 롤백 경로로 진입합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    /**
     * 현재 시각 기준 deadline 생성.
     *
     * @param clock 시계
     * @param timeout 허용 시간 (양수)
     * @return Deadline
     */
    public static Deadline after(Clock clock, Duration timeout) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * 남은 시간 (만료 시 0).
     *
     * @return 남은 시간
     */
    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * 만료 여부 확인.
     *
     * @param phase 현재 단계 (오류 메시지용)
     * @throws UpdateTimeoutException 만료된 경우
     */
    public void check(String phase) {
        if (isExpired()) {
            throw new UpdateTimeoutException("Deadline " + expiresAt + " elapsed during " + phase);
        }
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}

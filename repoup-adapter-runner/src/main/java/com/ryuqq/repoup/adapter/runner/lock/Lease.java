package com.ryuqq.repoup.adapter.runner.lock;

import java.time.Instant;

/**
 * Lease 오브젝트 ({@code <prefix>/lock}) 내용.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param repository 저장소 prefix
 * @param holderId 보유자 식별자 (업데이트 호출마다 고유)
 * @param acquiredAt 획득 또는 마지막 갱신 시각
 * @param expiresAt 만료 시각
 */
public record Lease(
    String repository,
    String holderId,
    Instant acquiredAt,
    Instant expiresAt
) {

    public Lease {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository cannot be null or blank");
        }
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId cannot be null or blank");
        }
        if (acquiredAt == null || expiresAt == null) {
            throw new IllegalArgumentException("acquiredAt and expiresAt cannot be null");
        }
        if (expiresAt.isBefore(acquiredAt)) {
            throw new IllegalArgumentException(
                "expiresAt must not be before acquiredAt (acquiredAt: " + acquiredAt + ", expiresAt: " + expiresAt + ")"
            );
        }
    }

    /**
     * 주어진 시각에 만료되었는지 확인.
     *
     * @param now 현재 시각
     * @return expiresAt이 지났으면 true
     */
    public boolean expiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}

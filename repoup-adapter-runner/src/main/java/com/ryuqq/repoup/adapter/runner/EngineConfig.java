package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.adapter.runner.lock.LockConfig;
import com.ryuqq.repoup.adapter.runner.storage.StorageRetryConfig;

import java.time.Duration;

/**
 * 업데이트 엔진 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>lockConfig: {@link LockConfig#LockConfig()}</li>
 *   <li>storageRetryConfig: {@link StorageRetryConfig#StorageRetryConfig()}</li>
 *   <li>defaultDeadline: 5분 (호출 옵션에 deadline이 없을 때)</li>
 *   <li>parallelism: 1 (저장소를 prefix 순으로 하나씩 처리)</li>
 *   <li>bestEffort: false (RESOLVING 실패 시 배치 전체 중단)</li>
 *   <li>deletePreviousMetadata: true (게시 후 이전 매니페스트만 참조하던 컴포넌트 삭제)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param lockConfig lease 설정
 * @param storageRetryConfig 스토리지 일시 오류 재시도 설정
 * @param defaultDeadline 기본 deadline
 * @param parallelism 서로 다른 저장소를 동시에 처리할 최대 개수
 * @param bestEffort 해석 실패 항목만 건너뛰고 나머지를 진행할지 여부
 * @param deletePreviousMetadata 이전 메타데이터 정리 여부
 */
public record EngineConfig(
    LockConfig lockConfig,
    StorageRetryConfig storageRetryConfig,
    Duration defaultDeadline,
    int parallelism,
    boolean bestEffort,
    boolean deletePreviousMetadata
) {

    /**
     * 기본 설정 생성자.
     */
    public EngineConfig() {
        this(new LockConfig(), new StorageRetryConfig(), Duration.ofMinutes(5), 1, false, true);
    }

    public EngineConfig {
        if (lockConfig == null) {
            throw new IllegalArgumentException("lockConfig cannot be null");
        }
        if (storageRetryConfig == null) {
            throw new IllegalArgumentException("storageRetryConfig cannot be null");
        }
        if (defaultDeadline == null || defaultDeadline.isNegative() || defaultDeadline.isZero()) {
            throw new IllegalArgumentException("defaultDeadline must be positive (current: " + defaultDeadline + ")");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive (current: " + parallelism + ")");
        }
    }

    public EngineConfig withLockConfig(LockConfig lockConfig) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }

    public EngineConfig withStorageRetryConfig(StorageRetryConfig storageRetryConfig) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }

    public EngineConfig withDefaultDeadline(Duration defaultDeadline) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }

    public EngineConfig withParallelism(int parallelism) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }

    public EngineConfig withBestEffort(boolean bestEffort) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }

    public EngineConfig withDeletePreviousMetadata(boolean deletePreviousMetadata) {
        return new EngineConfig(lockConfig, storageRetryConfig, defaultDeadline, parallelism, bestEffort, deletePreviousMetadata);
    }
}

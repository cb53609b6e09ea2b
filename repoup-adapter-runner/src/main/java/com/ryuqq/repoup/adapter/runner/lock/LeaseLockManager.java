package com.ryuqq.repoup.adapter.runner.lock;

import com.ryuqq.repoup.adapter.runner.BackoffCalculator;
import com.ryuqq.repoup.adapter.runner.Deadline;
import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.RepositoryBusyException;
import com.ryuqq.repoup.core.error.RepoupException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.spi.StoredObject;
import com.ryuqq.repoup.core.spi.VersionToken;
import com.ryuqq.repoup.core.statemachine.LockState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * 조건부 쓰기 기반 저장소 lease 관리자.
 *
 * <p>스토리지에 잠금 기능이 없으므로 {@code <prefix>/lock} 오브젝트에 대한
 * 조건부 put만으로 저장소 단위 단일 writer를 보장합니다.</p>
 *
 * <p><strong>획득:</strong></p>
 * <pre>
 * put(lock, lease, ifAbsent)
 *   ├─ 성공 → HELD
 *   └─ PreconditionFailed → get(lock)
 *        ├─ 만료됨 → put(lock, lease, ifMatch(방금 읽은 토큰))  (동시 회수자 중 하나만 성공)
 *        └─ 유효함 → backoff + jitter 후 재시도 (maxAttempts 초과 시 RepositoryBusy)
 * </pre>
 *
 * <p><strong>갱신:</strong> lease 절반이 지나면 put(lock, 새 lease, ifMatch(보유 토큰)).
 * 실패하면 lease를 잃은 것이므로 RepositoryBusy.</p>
 *
 * <p><strong>해제:</strong> lock을 다시 읽어 보유자와 토큰이 모두 일치할 때만 삭제합니다.
 * 스토리지에 조건부 삭제가 없으므로 확인과 삭제 사이의 경쟁은 남아 있으며,
 * 이 경우 다른 보유자의 lease가 지워질 수 있습니다.</p>
 *
 * <p><strong>제약:</strong> 만료 판단은 호출자 시계를 사용하므로 호출자 간 시계 오차가
 * 크면 선형화 가능성이 보장되지 않습니다. 저경합 단일 운영자 환경을 전제로 합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class LeaseLockManager {

    private static final Logger log = LoggerFactory.getLogger(LeaseLockManager.class);

    private final ObjectStorage storage;
    private final LockConfig config;
    private final Clock clock;
    private final BackoffCalculator backoffCalculator;

    /**
     * 생성자 (설정의 backoff 사용).
     *
     * @param storage 오브젝트 스토리지
     * @param config lock 설정
     * @param clock 시계
     */
    public LeaseLockManager(ObjectStorage storage, LockConfig config, Clock clock) {
        this(storage, config, clock, config == null ? null : config.backoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param storage 오브젝트 스토리지
     * @param config lock 설정
     * @param clock 시계
     * @param backoffCalculator 경합 재시도 backoff
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LeaseLockManager(ObjectStorage storage, LockConfig config, Clock clock, BackoffCalculator backoffCalculator) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.storage = storage;
        this.config = config;
        this.clock = clock;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * Lease 획득.
     *
     * @param prefix 저장소 prefix
     * @param holderId 보유자 식별자
     * @param deadline 호출자 deadline
     * @return HELD 상태의 핸들
     * @throws RepositoryBusyException maxAttempts 안에 획득하지 못한 경우
     * @throws UpdateTimeoutException 획득 전에 deadline이 지난 경우
     */
    public LeaseHandle acquire(RepositoryPrefix prefix, String holderId, Deadline deadline) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId cannot be null or blank");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }

        LeaseHandle handle = new LeaseHandle(prefix);
        handle.moveTo(LockState.ACQUIRING);
        String lockKey = prefix.lockKey();
        Lease observed = null;

        try {
            for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
                deadline.check("LOCKING " + prefix);
                Lease candidate = newLease(prefix, holderId);
                byte[] candidateBytes = LeaseCodec.encode(candidate);

                try {
                    VersionToken token = storage.put(lockKey, candidateBytes, Precondition.ifAbsent());
                    handle.held(candidate, token);
                    log.info("Lease acquired: repository={}, holder={}, expiresAt={}",
                        prefix, holderId, candidate.expiresAt());
                    return handle;
                } catch (PreconditionFailedException e) {
                    log.debug("Lock object exists for {}, inspecting current lease", prefix);
                }

                StoredObject current;
                try {
                    current = storage.get(lockKey);
                } catch (ObjectNotFoundException e) {
                    // 그 사이 해제됨: 대기 없이 재시도
                    continue;
                }
                observed = decodeOrNull(current);

                if (Arrays.equals(candidateBytes, current.content())) {
                    // 응답 유실 후 재시도된 put이 이미 성공한 경우 (보유자 ID만 같은 lease는 해당 없음)
                    handle.held(observed, current.version());
                    log.info("Lease acquired (write confirmed on re-read): repository={}, holder={}", prefix, holderId);
                    return handle;
                }

                if (observed == null || observed.expiredAt(clock.instant())) {
                    Lease reclaimed = newLease(prefix, holderId);
                    try {
                        VersionToken token = storage.put(lockKey, LeaseCodec.encode(reclaimed), Precondition.ifMatch(current.version()));
                        handle.held(reclaimed, token);
                        log.warn("Reclaimed expired lease: repository={}, previousHolder={}, expiredAt={}, holder={}",
                            prefix,
                            observed == null ? "<unreadable>" : observed.holderId(),
                            observed == null ? "<unknown>" : observed.expiresAt(),
                            holderId);
                        return handle;
                    } catch (PreconditionFailedException e) {
                        log.warn("Lost lease reclaim race: repository={}, holder={}", prefix, holderId);
                    }
                }

                if (attempt < config.maxAttempts()) {
                    long delay = backoffCalculator.calculate(attempt);
                    log.warn("Repository {} is locked by {} (attempt {}/{}), retrying in {}ms",
                        prefix, observed == null ? "<unknown>" : observed.holderId(), attempt, config.maxAttempts(), delay);
                    sleep(Math.min(delay, deadline.remaining().toMillis()), prefix);
                }
            }
        } catch (RuntimeException e) {
            handle.moveTo(LockState.UNLOCKED);
            throw e;
        }

        handle.moveTo(LockState.UNLOCKED);
        throw new RepositoryBusyException(String.format(
            "Repository %s is busy: lock held by %s until %s (gave up after %d attempts)",
            prefix,
            observed == null ? "<unknown>" : observed.holderId(),
            observed == null ? "<unknown>" : observed.expiresAt(),
            config.maxAttempts()
        ));
    }

    /**
     * Lease 유효 시간의 절반이 지났으면 갱신.
     *
     * @param handle 보유 중인 핸들
     * @return 갱신했으면 true
     * @throws RepositoryBusyException lease를 잃은 경우 (다른 보유자가 회수)
     */
    public boolean renewIfNeeded(LeaseHandle handle) {
        requireHeld(handle);
        Lease lease = handle.getLease();
        Duration half = config.leaseDuration().dividedBy(2);
        if (clock.instant().isBefore(lease.acquiredAt().plus(half))) {
            return false;
        }
        renew(handle);
        return true;
    }

    /**
     * Lease 갱신 (보유 토큰 기준 조건부 put).
     *
     * @param handle 보유 중인 핸들
     * @throws RepositoryBusyException lease를 잃은 경우
     */
    public void renew(LeaseHandle handle) {
        requireHeld(handle);
        RepositoryPrefix prefix = handle.getPrefix();
        handle.moveTo(LockState.RENEWING);
        Lease renewed = newLease(prefix, handle.getHolderId());
        try {
            VersionToken token = storage.put(prefix.lockKey(), LeaseCodec.encode(renewed), Precondition.ifMatch(handle.getToken()));
            handle.held(renewed, token);
            log.info("Lease renewed: repository={}, holder={}, expiresAt={}", prefix, renewed.holderId(), renewed.expiresAt());
        } catch (PreconditionFailedException e) {
            handle.moveTo(LockState.UNLOCKED);
            throw new RepositoryBusyException("Lease on " + prefix + " was lost (taken over after expiry)", e);
        } catch (RuntimeException e) {
            // 갱신 결과를 알 수 없음: 토큰은 유지하고 다음 조건부 쓰기에서 판별
            handle.moveTo(LockState.HELD);
            throw e;
        }
    }

    /**
     * 핸들이 여전히 유효한 lease를 가리키는지 확인.
     *
     * <p>만료 전이고 lock 오브젝트의 토큰이 보유 토큰과 같을 때만 true입니다.
     * 읽기 실패는 보유하지 않은 것으로 봅니다.</p>
     *
     * @param handle lease 핸들
     * @return 유효하게 보유 중이면 true
     */
    public boolean isStillHeld(LeaseHandle handle) {
        if (handle == null || !handle.isHeld()) {
            return false;
        }
        if (handle.getLease().expiredAt(clock.instant())) {
            return false;
        }
        RepositoryPrefix prefix = handle.getPrefix();
        try {
            return handle.getToken().equals(storage.get(prefix.lockKey()).version());
        } catch (ObjectNotFoundException e) {
            return false;
        } catch (RepoupException e) {
            log.warn("Could not verify lease on {}: {}", prefix, e.getMessage());
            return false;
        }
    }

    /**
     * Lease 해제.
     *
     * <p>lock 오브젝트를 다시 읽어 보유자와 토큰이 모두 일치할 때만 삭제합니다.
     * 해제 실패는 치명적이지 않으며 (lease는 만료로 회수됨) 경고 로그만 남깁니다.</p>
     *
     * @param handle 보유 중인 핸들
     * @return 삭제했으면 true
     */
    public boolean release(LeaseHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (!handle.isHeld()) {
            return false;
        }
        RepositoryPrefix prefix = handle.getPrefix();
        handle.moveTo(LockState.RELEASING);
        try {
            StoredObject current = storage.get(prefix.lockKey());
            Lease observed = decodeOrNull(current);
            if (observed == null
                || !handle.getHolderId().equals(observed.holderId())
                || !handle.getToken().equals(current.version())) {
                log.warn("Lease on {} is no longer ours (holder={}), leaving it in place",
                    prefix, observed == null ? "<unreadable>" : observed.holderId());
                return false;
            }
            storage.delete(prefix.lockKey());
            log.info("Lease released: repository={}, holder={}", prefix, handle.getHolderId());
            return true;
        } catch (ObjectNotFoundException e) {
            log.warn("Lease on {} already gone at release", prefix);
            return false;
        } catch (RepoupException e) {
            log.warn("Failed to release lease on {}, it will expire at {}: {}",
                prefix, handle.getLease().expiresAt(), e.getMessage());
            return false;
        } finally {
            handle.moveTo(LockState.UNLOCKED);
        }
    }

    public LockConfig getConfig() {
        return config;
    }

    private Lease newLease(RepositoryPrefix prefix, String holderId) {
        Instant now = clock.instant();
        return new Lease(prefix.getValue(), holderId, now, now.plus(config.leaseDuration()));
    }

    private static Lease decodeOrNull(StoredObject stored) {
        try {
            return LeaseCodec.decode(stored.content());
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable lease object {}, treating it as expired: {}", stored.key(), e.getMessage());
            return null;
        }
    }

    private static void requireHeld(LeaseHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (!handle.isHeld()) {
            throw new IllegalStateException("Lease on " + handle.getPrefix() + " is not held (state: " + handle.getState() + ")");
        }
    }

    private static void sleep(long millis, RepositoryPrefix prefix) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryBusyException("Interrupted while waiting for lock on " + prefix, e);
        }
    }
}

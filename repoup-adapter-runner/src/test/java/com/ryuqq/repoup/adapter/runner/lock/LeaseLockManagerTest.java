package com.ryuqq.repoup.adapter.runner.lock;

import com.ryuqq.repoup.adapter.inmemory.storage.InMemoryObjectStorage;
import com.ryuqq.repoup.adapter.runner.Deadline;
import com.ryuqq.repoup.core.error.RepositoryBusyException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.statemachine.LockState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LeaseLockManager 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>빈 저장소 획득, 경합 시 RepositoryBusy</li>
 *   <li>만료된 lease 회수, 응답 유실 후 재확인</li>
 *   <li>갱신 및 lease 상실 감지</li>
 *   <li>보유 여부 확인, 보유자 확인 후 해제</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class LeaseLockManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final RepositoryPrefix PREFIX = RepositoryPrefix.of("/arm");

    private InMemoryObjectStorage storage;
    private LockConfig config;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
        config = new LockConfig()
            .withMaxAttempts(3)
            .withBackoff(Duration.ofMillis(1), Duration.ofMillis(2));
    }

    private LeaseLockManager managerAt(Instant now) {
        return new LeaseLockManager(storage, config, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static Deadline deadlineAt(Instant now) {
        return Deadline.after(Clock.fixed(now, ZoneOffset.UTC), Duration.ofMinutes(1));
    }

    private Lease storedLease() {
        return LeaseCodec.decode(storage.get(PREFIX.lockKey()).content());
    }

    @Test
    void 빈_저장소에서_lease_획득_성공() {
        // when
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));

        // then
        assertThat(handle.isHeld()).isTrue();
        assertThat(handle.getState()).isEqualTo(LockState.HELD);
        assertThat(handle.getLease().expiresAt()).isEqualTo(T0.plus(config.leaseDuration()));
        assertThat(storedLease().holderId()).isEqualTo("holder-a");
        assertThat(storedLease().repository()).isEqualTo("/arm");
    }

    @Test
    void 유효한_lease가_있으면_maxAttempts_후_RepositoryBusy() {
        // given
        managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant later = T0.plusSeconds(10);

        // when & then
        assertThatThrownBy(() -> managerAt(later).acquire(PREFIX, "holder-b", deadlineAt(later)))
            .isInstanceOf(RepositoryBusyException.class)
            .hasMessageContaining("holder-a")
            .hasMessageContaining("3 attempts");
        assertThat(storedLease().holderId()).isEqualTo("holder-a");
    }

    @Test
    void 만료된_lease는_새_획득자가_회수() {
        // given
        managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant afterExpiry = T0.plus(config.leaseDuration()).plusSeconds(1);

        // when
        LeaseHandle handle = managerAt(afterExpiry).acquire(PREFIX, "holder-b", deadlineAt(afterExpiry));

        // then
        assertThat(handle.isHeld()).isTrue();
        assertThat(storedLease().holderId()).isEqualTo("holder-b");
    }

    @Test
    void 읽을_수_없는_lock_오브젝트는_만료된_것으로_취급() {
        // given
        storage.put(PREFIX.lockKey(), "garbage".getBytes(StandardCharsets.UTF_8), Precondition.none());

        // when
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));

        // then
        assertThat(handle.isHeld()).isTrue();
        assertThat(storedLease().holderId()).isEqualTo("holder-a");
    }

    @Test
    void 회수_경합에서_지면_재시도_후_RepositoryBusy() {
        // given: 만료된 lease
        managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant afterExpiry = T0.plus(config.leaseDuration()).plusSeconds(1);
        Lease competitor = new Lease("/arm", "holder-c", afterExpiry, afterExpiry.plus(config.leaseDuration()));

        // 두 번째 put(회수 시도) 직전에 다른 회수자가 먼저 씀
        int[] lockPuts = {0};
        storage.onPut(key -> {
            if (key.equals(PREFIX.lockKey()) && ++lockPuts[0] == 2) {
                storage.onPut(null);
                storage.put(key, LeaseCodec.encode(competitor), Precondition.none());
            }
        });

        // when & then
        assertThatThrownBy(() -> managerAt(afterExpiry).acquire(PREFIX, "holder-b", deadlineAt(afterExpiry)))
            .isInstanceOf(RepositoryBusyException.class)
            .hasMessageContaining("holder-c");
        assertThat(storedLease().holderId()).isEqualTo("holder-c");
    }

    @Test
    void 재시도된_쓰기가_이미_성공했으면_자신의_lease를_채택() {
        // given: 응답이 유실된 첫 번째 put
        Lease own = new Lease("/arm", "holder-a", T0, T0.plus(config.leaseDuration()));
        storage.put(PREFIX.lockKey(), LeaseCodec.encode(own), Precondition.ifAbsent());

        // when
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));

        // then
        assertThat(handle.isHeld()).isTrue();
        assertThat(handle.getToken()).isEqualTo(storage.get(PREFIX.lockKey()).version());
    }

    @Test
    void 보유자_ID만_같은_다른_lease는_채택하지_않음() {
        // given: 같은 보유자 ID로 10초 전에 획득되어 아직 유효한 lease
        Lease earlier = new Lease("/arm", "holder-a", T0.minusSeconds(10), T0.minusSeconds(10).plus(config.leaseDuration()));
        byte[] earlierBytes = LeaseCodec.encode(earlier);
        storage.put(PREFIX.lockKey(), earlierBytes, Precondition.ifAbsent());

        // when & then
        assertThatThrownBy(() -> managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0)))
            .isInstanceOf(RepositoryBusyException.class);
        assertThat(storage.get(PREFIX.lockKey()).content()).isEqualTo(earlierBytes);
    }

    @Test
    void 만료_전이고_토큰이_같으면_보유_중() {
        // given
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));

        // when & then
        assertThat(managerAt(T0.plusSeconds(30)).isStillHeld(handle)).isTrue();
    }

    @Test
    void 만료되었거나_다른_보유자가_회수하면_보유_중이_아님() {
        // given
        LeaseHandle stalled = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant afterExpiry = T0.plus(config.leaseDuration()).plusSeconds(1);

        // when: 만료만 된 상태
        boolean expiredOnly = managerAt(afterExpiry).isStillHeld(stalled);
        managerAt(afterExpiry).acquire(PREFIX, "holder-b", deadlineAt(afterExpiry));

        // then
        assertThat(expiredOnly).isFalse();
        assertThat(managerAt(T0.plusSeconds(1)).isStillHeld(stalled)).isFalse();
        assertThat(storedLease().holderId()).isEqualTo("holder-b");
    }

    @Test
    void deadline이_지났으면_스토리지를_건드리지_않고_Timeout() {
        // given
        SteppingClock clock = new SteppingClock(T0);
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(30));
        clock.advance(Duration.ofMinutes(1));

        // when & then
        assertThatThrownBy(() -> new LeaseLockManager(storage, config, clock).acquire(PREFIX, "holder-a", deadline))
            .isInstanceOf(UpdateTimeoutException.class)
            .hasMessageContaining("LOCKING");
        assertThat(storage.size()).isZero();
    }

    @Test
    void lease_절반_이전에는_갱신하지_않음() {
        // given
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));

        // when
        boolean renewed = managerAt(T0.plusSeconds(10)).renewIfNeeded(handle);

        // then
        assertThat(renewed).isFalse();
        assertThat(storedLease().expiresAt()).isEqualTo(T0.plus(config.leaseDuration()));
    }

    @Test
    void lease_절반이_지나면_갱신() {
        // given
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant halfway = T0.plus(config.leaseDuration().dividedBy(2)).plusSeconds(1);

        // when
        boolean renewed = managerAt(halfway).renewIfNeeded(handle);

        // then
        assertThat(renewed).isTrue();
        assertThat(handle.isHeld()).isTrue();
        assertThat(storedLease().expiresAt()).isEqualTo(halfway.plus(config.leaseDuration()));
        assertThat(handle.getToken()).isEqualTo(storage.get(PREFIX.lockKey()).version());
    }

    @Test
    void 다른_보유자가_회수한_lease는_갱신_시_RepositoryBusy() {
        // given
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant afterExpiry = T0.plus(config.leaseDuration()).plusSeconds(1);
        managerAt(afterExpiry).acquire(PREFIX, "holder-b", deadlineAt(afterExpiry));

        // when & then
        assertThatThrownBy(() -> managerAt(afterExpiry).renew(handle))
            .isInstanceOf(RepositoryBusyException.class)
            .hasMessageContaining("lost");
        assertThat(handle.isHeld()).isFalse();
        assertThat(storedLease().holderId()).isEqualTo("holder-b");
    }

    @Test
    void 보유자는_lease를_해제() {
        // given
        LeaseLockManager manager = managerAt(T0);
        LeaseHandle handle = manager.acquire(PREFIX, "holder-a", deadlineAt(T0));

        // when
        boolean released = manager.release(handle);

        // then
        assertThat(released).isTrue();
        assertThat(handle.getState()).isEqualTo(LockState.UNLOCKED);
        assertThat(storage.exists(PREFIX.lockKey())).isFalse();
    }

    @Test
    void 다른_보유자의_lease는_해제하지_않음() {
        // given
        LeaseHandle handle = managerAt(T0).acquire(PREFIX, "holder-a", deadlineAt(T0));
        Instant afterExpiry = T0.plus(config.leaseDuration()).plusSeconds(1);
        managerAt(afterExpiry).acquire(PREFIX, "holder-b", deadlineAt(afterExpiry));

        // when
        boolean released = managerAt(afterExpiry).release(handle);

        // then
        assertThat(released).isFalse();
        assertThat(handle.getState()).isEqualTo(LockState.UNLOCKED);
        assertThat(storedLease().holderId()).isEqualTo("holder-b");
    }

    @Test
    void 해제_실패는_예외_없이_false() {
        // given
        LeaseLockManager manager = managerAt(T0);
        LeaseHandle handle = manager.acquire(PREFIX, "holder-a", deadlineAt(T0));
        storage.failDeletesMatching(key -> key.endsWith("lock"));

        // when
        boolean released = manager.release(handle);

        // then
        assertThat(released).isFalse();
        assertThat(handle.isHeld()).isFalse();
        assertThat(storage.exists(PREFIX.lockKey())).isTrue();
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

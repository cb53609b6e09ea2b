package com.ryuqq.repoup.adapter.runner.lock;

import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.VersionToken;
import com.ryuqq.repoup.core.statemachine.LockState;
import com.ryuqq.repoup.core.statemachine.StateTransition;

/**
 * 획득한 lease에 대한 핸들.
 *
 * <p>현재 lease 내용, lock 오브젝트의 버전 토큰, lease 상태를 추적합니다.
 * 갱신과 해제는 항상 이 토큰을 전제 조건으로 사용합니다.
 * 하나의 업데이트 스레드에서만 사용합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class LeaseHandle {

    private final RepositoryPrefix prefix;
    private Lease lease;
    private VersionToken token;
    private LockState state;

    LeaseHandle(RepositoryPrefix prefix) {
        this.prefix = prefix;
        this.state = LockState.UNLOCKED;
    }

    void moveTo(LockState next) {
        state = StateTransition.transition(state, next);
    }

    void held(Lease lease, VersionToken token) {
        this.lease = lease;
        this.token = token;
        moveTo(LockState.HELD);
    }

    public RepositoryPrefix getPrefix() {
        return prefix;
    }

    public Lease getLease() {
        return lease;
    }

    public VersionToken getToken() {
        return token;
    }

    public LockState getState() {
        return state;
    }

    public boolean isHeld() {
        return state.isHeld();
    }

    public String getHolderId() {
        return lease == null ? null : lease.holderId();
    }

    @Override
    public String toString() {
        return "LeaseHandle{prefix=" + prefix + ", state=" + state + ", holderId=" + getHolderId() + "}";
    }
}

package com.ryuqq.repoup.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.repoup.core.statemachine.UpdateState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (IDLE → ... → DONE)</li>
 *   <li>변경 없음 단축 경로 (STAGING → RELEASING)</li>
 *   <li>FAILING은 STAGING 이후에서만 진입 가능</li>
 *   <li>종료 상태에서 전이 불가</li>
 *   <li>Lease 상태 전이</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void transition_HappyPath_ReachesDone() {
        UpdateState state = IDLE;

        for (UpdateState next : new UpdateState[] {
            RESOLVING, LOCKING, STAGING, BUILDING_METADATA, SIGNING, PUBLISHING, RELEASING, DONE}) {
            state = StateTransition.transition(state, next);
        }

        assertEquals(DONE, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_StagingToReleasing_SucceedsForNoOpUpdate() {
        assertDoesNotThrow(() -> StateTransition.validate(STAGING, RELEASING));
    }

    @Test
    void validate_ResolvingAndLockingCanAbort() {
        assertDoesNotThrow(() -> StateTransition.validate(RESOLVING, ABORTED));
        assertDoesNotThrow(() -> StateTransition.validate(LOCKING, ABORTED));
    }

    // ========== 롤백 ==========

    @Test
    void validate_FailingFromStagedStates_Succeeds() {
        for (UpdateState from : new UpdateState[] {STAGING, BUILDING_METADATA, SIGNING, PUBLISHING}) {
            assertTrue(from.requiresRollback());
            assertDoesNotThrow(() -> StateTransition.validate(from, FAILING));
        }
        assertEquals(ROLLED_BACK, StateTransition.transition(FAILING, ROLLED_BACK));
    }

    @Test
    void validate_FailingBeforeStaging_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(LOCKING, FAILING)
        );
        assertTrue(exception.getMessage().contains("LOCKING"));
    }

    // ========== 불법 전이 ==========

    @Test
    void validate_Backwards_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PUBLISHING, STAGING)
        );
        assertEquals("Invalid state transition: PUBLISHING → STAGING", exception.getMessage());
    }

    @Test
    void validate_FromTerminal_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(DONE, IDLE));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ROLLED_BACK, RELEASING));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ABORTED, RESOLVING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate((UpdateState) null, DONE));
    }

    // ========== Lease 상태 ==========

    @Test
    void lockTransition_AcquireRenewRelease() {
        LockState state = LockState.UNLOCKED;

        state = StateTransition.transition(state, LockState.ACQUIRING);
        state = StateTransition.transition(state, LockState.HELD);
        assertTrue(state.isHeld());
        state = StateTransition.transition(state, LockState.RENEWING);
        assertTrue(state.isHeld());
        state = StateTransition.transition(state, LockState.HELD);
        state = StateTransition.transition(state, LockState.RELEASING);
        state = StateTransition.transition(state, LockState.UNLOCKED);

        assertEquals(LockState.UNLOCKED, state);
    }

    @Test
    void lockTransition_UnlockedToHeldDirectly_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(LockState.UNLOCKED, LockState.HELD));
    }
}

package com.ryuqq.repoup.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>업데이트 상태({@link UpdateState})와 lease 상태({@link LockState})의 전이가
 * 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: PUBLISHING → STAGING)</li>
 *   <li>FAILING은 STAGING 이후 상태에서만 진입 가능</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 업데이트 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(UpdateState from, UpdateState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (to == UpdateState.FAILING) {
            if (!from.requiresRollback()) {
                throw new IllegalStateException(
                    String.format("Rollback is only reachable after STAGING: %s → %s", from, to)
                );
            }
            return;
        }

        boolean valid = switch (from) {
            case IDLE -> to == UpdateState.RESOLVING;
            case RESOLVING -> to == UpdateState.LOCKING || to == UpdateState.ABORTED;
            case LOCKING -> to == UpdateState.STAGING || to == UpdateState.ABORTED;
            case STAGING -> to == UpdateState.BUILDING_METADATA || to == UpdateState.RELEASING;
            case BUILDING_METADATA -> to == UpdateState.SIGNING;
            case SIGNING -> to == UpdateState.PUBLISHING;
            case PUBLISHING -> to == UpdateState.RELEASING;
            case RELEASING -> to == UpdateState.DONE;
            case FAILING -> to == UpdateState.ROLLED_BACK;
            case DONE, ABORTED, ROLLED_BACK -> false; // 종료 상태 (위에서 이미 체크했지만 명시적 표현)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 업데이트 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static UpdateState transition(UpdateState current, UpdateState next) {
        validate(current, next);
        return next;
    }

    /**
     * lease 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(LockState from, LockState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case UNLOCKED -> to == LockState.ACQUIRING;
            case ACQUIRING -> to == LockState.HELD || to == LockState.UNLOCKED;
            case HELD -> to == LockState.RENEWING || to == LockState.RELEASING;
            case RENEWING -> to == LockState.HELD || to == LockState.UNLOCKED;
            case RELEASING -> to == LockState.UNLOCKED;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid lock state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * lease 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static LockState transition(LockState current, LockState next) {
        validate(current, next);
        return next;
    }
}

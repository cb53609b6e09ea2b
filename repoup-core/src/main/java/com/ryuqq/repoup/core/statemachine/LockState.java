package com.ryuqq.repoup.core.statemachine;

/**
 * 저장소 lease의 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNLOCKED → ACQUIRING (획득 시도)</li>
 *   <li>ACQUIRING → HELD (획득 성공) / UNLOCKED (재시도 한도 초과)</li>
 *   <li>HELD → RENEWING (만료 연장) / RELEASING (반납)</li>
 *   <li>RENEWING → HELD (연장 성공) / UNLOCKED (다른 holder에게 빼앗김)</li>
 *   <li>RELEASING → UNLOCKED</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public enum LockState {

    UNLOCKED,

    ACQUIRING,

    HELD,

    RENEWING,

    RELEASING;

    /**
     * lease를 보유 중인 상태인지 확인.
     *
     * @return HELD 또는 RENEWING인 경우 true
     */
    public boolean isHeld() {
        return this == HELD || this == RENEWING;
    }
}

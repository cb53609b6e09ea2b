package com.ryuqq.repoup.core.statemachine;

/**
 * 저장소 하나에 대한 업데이트 시도의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE → RESOLVING → LOCKING → STAGING → BUILDING_METADATA → SIGNING → PUBLISHING → RELEASING → DONE
 *            │           │         │             │               │           │
 *            └───────────┴─► ABORTED (스토리지 변경 전 실패)
 *                                  │             │               │           │
 *                                  └─────────────┴───────────────┴───────────┴─► FAILING → ROLLED_BACK
 *
 * STAGING → RELEASING : 변경 사항 없음 (동일 콘텐츠 재추가, 이미 초기화된 저장소)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(DONE, ABORTED, ROLLED_BACK)에서는 어떤 상태로도 전이 불가</li>
 *   <li>FAILING은 STAGING 이후에만 도달 가능 (스테이징된 오브젝트가 있을 수 있는 구간)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public enum UpdateState {

    /** 시작 전. */
    IDLE,

    /** 패키지 식별 정보 추출 및 저장소 해석 중. */
    RESOLVING,

    /** 저장소 lease 획득 중. */
    LOCKING,

    /** 서명된 패키지 업로드 및 현재 인덱스 조회 중. */
    STAGING,

    /** 새 인덱스 컴포넌트 생성 중. */
    BUILDING_METADATA,

    /** 새 매니페스트 서명 중. */
    SIGNING,

    /** 컴포넌트 게시 후 매니페스트 교체 중. */
    PUBLISHING,

    /** lease 반납 중. */
    RELEASING,

    /** 완료 (성공). */
    DONE,

    /** 스토리지 변경 전에 실패 (롤백 불필요). */
    ABORTED,

    /** 실패 후 스테이징 오브젝트 정리 중. */
    FAILING,

    /** 롤백 완료 (이전 게시 상태 유지). */
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE, ABORTED, ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == ABORTED || this == ROLLED_BACK;
    }

    /**
     * 이 상태에서 실패하면 롤백이 필요한지 확인.
     *
     * @return STAGING, BUILDING_METADATA, SIGNING, PUBLISHING인 경우 true
     */
    public boolean requiresRollback() {
        return this == STAGING || this == BUILDING_METADATA || this == SIGNING || this == PUBLISHING;
    }
}

package com.ryuqq.repoup.core.outcome;

/**
 * 성공한 리포트 항목이 저장소에 미친 영향.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public enum EntryAction {

    /**
     * 패키지가 인덱스에 추가됨.
     */
    ADDED,

    /**
     * 패키지가 인덱스에서 제거됨.
     */
    REMOVED,

    /**
     * 동일한 콘텐츠가 이미 존재하거나 저장소가 이미 초기화되어 있어 변경 없음.
     */
    UNCHANGED,

    /**
     * 빈 저장소가 새로 초기화됨.
     */
    INITIALIZED,

    /**
     * dry-run: 대상 저장소만 해석됨 (스토리지 변경 없음).
     */
    RESOLVED
}

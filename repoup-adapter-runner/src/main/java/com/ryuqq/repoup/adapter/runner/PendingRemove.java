package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.core.model.ContentHash;

/**
 * RESOLVING을 통과한 제거 요청 (해시가 인덱싱된 저장소 하나당 하나).
 *
 * @param position 리포트 내 위치
 * @param subject 리포트 subject (해시 문자열)
 * @param hash 제거할 해시
 */
record PendingRemove(
    int position,
    String subject,
    ContentHash hash
) {

    PendingRemove {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
    }
}

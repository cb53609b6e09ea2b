package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;

import java.util.List;

/**
 * 한 저장소에 대한 한 번의 업데이트 요청.
 *
 * <p>추가, 제거, 초기화 중 하나만 담습니다 (엔진 호출 하나가 한 종류의 변경만 만들기 때문).</p>
 *
 * @param prefix 대상 저장소
 * @param adds 추가 요청
 * @param removes 제거 요청
 * @param initFormat 초기화 요청 포맷 (초기화가 아니면 null)
 * @param initPosition 초기화 요청의 리포트 위치
 */
record RepositoryChangeSet(
    RepositoryPrefix prefix,
    List<PendingAdd> adds,
    List<PendingRemove> removes,
    PackageFormat initFormat,
    int initPosition
) {

    RepositoryChangeSet {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        adds = adds == null ? List.of() : List.copyOf(adds);
        removes = removes == null ? List.of() : List.copyOf(removes);
    }

    static RepositoryChangeSet adding(RepositoryPrefix prefix, List<PendingAdd> adds) {
        return new RepositoryChangeSet(prefix, adds, List.of(), null, -1);
    }

    static RepositoryChangeSet removing(RepositoryPrefix prefix, List<PendingRemove> removes) {
        return new RepositoryChangeSet(prefix, List.of(), removes, null, -1);
    }

    static RepositoryChangeSet initializing(RepositoryPrefix prefix, PackageFormat format, int position) {
        return new RepositoryChangeSet(prefix, List.of(), List.of(), format, position);
    }

    boolean isInit() {
        return initFormat != null;
    }
}

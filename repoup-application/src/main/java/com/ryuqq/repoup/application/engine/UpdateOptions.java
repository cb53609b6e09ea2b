package com.ryuqq.repoup.application.engine;

import java.time.Duration;
import java.util.Map;

/**
 * 업데이트 호출 옵션 (불변 record).
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param deadline 호출 전체 마감 시간 (null이면 엔진 기본값)
 * @param bestEffort true이면 RESOLVING 실패 항목만 제외하고 나머지를 진행
 * @param removeSource addStored 성공 후 원본 오브젝트 삭제 여부
 * @param variables target_prefix 템플릿에 사용할 추가 변수
 */
public record UpdateOptions(
    Duration deadline,
    boolean bestEffort,
    boolean removeSource,
    Map<String, String> variables
) {

    public UpdateOptions {
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive (current: " + deadline + ")");
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    /**
     * 기본 옵션 (엔진 기본 마감 시간, all-or-nothing, 원본 유지).
     *
     * @return 기본 옵션
     */
    public static UpdateOptions defaults() {
        return new UpdateOptions(null, false, false, Map.of());
    }

    public UpdateOptions withDeadline(Duration deadline) {
        return new UpdateOptions(deadline, bestEffort, removeSource, variables);
    }

    public UpdateOptions withBestEffort(boolean bestEffort) {
        return new UpdateOptions(deadline, bestEffort, removeSource, variables);
    }

    public UpdateOptions withRemoveSource(boolean removeSource) {
        return new UpdateOptions(deadline, bestEffort, removeSource, variables);
    }

    public UpdateOptions withVariables(Map<String, String> variables) {
        return new UpdateOptions(deadline, bestEffort, removeSource, variables);
    }
}

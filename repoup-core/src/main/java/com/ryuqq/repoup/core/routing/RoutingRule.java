package com.ryuqq.repoup.core.routing;

import com.ryuqq.repoup.core.model.PackageDescriptor;

/**
 * 단일 라우팅 규칙 ({@code {match: predicate, target_prefix: string}}).
 *
 * <p>{@code targetPrefix}는 {@code $arch}, {@code $basearch}, {@code $releasever} 등
 * 템플릿 변수를 포함할 수 있으며, {@link RepositoryLocator}가 치환합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param match 매칭 조건
 * @param targetPrefix 대상 저장소 prefix (템플릿)
 */
public record RoutingRule(RulePredicate match, String targetPrefix) {

    public RoutingRule {
        if (match == null) {
            throw new IllegalArgumentException("match cannot be null");
        }
        if (targetPrefix == null || targetPrefix.isBlank()) {
            throw new IllegalArgumentException("targetPrefix cannot be null or blank");
        }
    }

    public boolean matches(PackageDescriptor descriptor) {
        return match.matches(descriptor);
    }
}

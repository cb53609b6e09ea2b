package com.ryuqq.repoup.core.routing;

import com.ryuqq.repoup.core.error.NoMatchingRepositoryException;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.RepositoryPrefix;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 패키지 디스크립터를 대상 저장소 prefix로 매핑하는 결정적 순수 함수.
 *
 * <p>규칙 목록을 순서대로 평가하여 첫 번째 매칭 규칙의 {@code target_prefix}를 사용합니다.
 * 공유 가변 상태가 없으므로 하나의 인스턴스를 여러 스레드가 동시에 사용할 수 있습니다.</p>
 *
 * <p><strong>템플릿 변수:</strong></p>
 * <ul>
 *   <li>{@code $arch}, {@code $basearch}: 패키지 architecture</li>
 *   <li>{@code $releasever}: os_tag에서 앞의 문자를 제거한 값 (el8 → 8)</li>
 *   <li>{@code $name}, {@code $format}: 패키지 이름, 포맷 확장자</li>
 *   <li>호출자가 전달한 추가 변수 (같은 이름이면 패키지에서 얻은 값이 우선)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RepositoryLocator {

    private final RoutingRules rules;

    public RepositoryLocator(RoutingRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = rules;
    }

    /**
     * 대상 저장소 결정.
     *
     * @param descriptor 패키지 디스크립터
     * @return 대상 저장소 prefix
     * @throws NoMatchingRepositoryException 매칭되는 규칙이 없거나 템플릿 변수를 치환할 수 없는 경우
     */
    public RepositoryPrefix resolve(PackageDescriptor descriptor) {
        return resolve(descriptor, Map.of());
    }

    /**
     * 추가 템플릿 변수를 사용하여 대상 저장소 결정.
     *
     * @param descriptor 패키지 디스크립터
     * @param variables 추가 템플릿 변수 (이름에 '$' 제외)
     * @return 대상 저장소 prefix
     * @throws NoMatchingRepositoryException 매칭되는 규칙이 없거나 템플릿 변수를 치환할 수 없는 경우
     */
    public RepositoryPrefix resolve(PackageDescriptor descriptor, Map<String, String> variables) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        RoutingRule rule = rules.firstMatch(descriptor).orElseThrow(() -> new NoMatchingRepositoryException(
            "No repository matches " + descriptor.identity()
                + " (arch=" + descriptor.architecture()
                + ", os_tag=" + descriptor.osTag()
                + ", format=" + descriptor.format() + ")"
        ));
        String target = substitute(rule.targetPrefix(), templateVariables(descriptor, variables));
        if (target.contains("$")) {
            throw new NoMatchingRepositoryException(
                "Unresolved variable in target prefix \"" + target + "\" for " + descriptor.identity()
            );
        }
        return RepositoryPrefix.of(target);
    }

    public RoutingRules getRules() {
        return rules;
    }

    private static Map<String, String> templateVariables(PackageDescriptor descriptor, Map<String, String> extra) {
        Map<String, String> values = new HashMap<>();
        // 패키지에서 얻은 값이 호출자 변수보다 우선
        if (extra != null) {
            values.putAll(extra);
        }
        values.put("arch", descriptor.architecture());
        values.put("basearch", descriptor.architecture());
        values.put("name", descriptor.name());
        values.put("format", descriptor.format().extension());
        if (descriptor.releasever() != null) {
            values.put("releasever", descriptor.releasever());
        }
        return values;
    }

    private static String substitute(String template, Map<String, String> values) {
        String result = template;
        // 긴 이름부터 치환 ($basearch가 $arch로 먼저 치환되는 것 방지)
        List<String> names = values.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
        for (String name : names) {
            result = result.replace("$" + name, values.get(name));
        }
        return result;
    }
}

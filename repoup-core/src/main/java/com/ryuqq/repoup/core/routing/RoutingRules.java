package com.ryuqq.repoup.core.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.repoup.core.model.PackageDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 순서가 있는 라우팅 규칙 목록. 첫 번째로 매칭되는 규칙이 적용됩니다.
 *
 * <p><strong>JSON 형식:</strong></p>
 * <pre>
 * [
 *   {"match": {"arch": "aarch64"}, "target_prefix": "/arm"},
 *   {"match": {"arch": "*"}, "target_prefix": "/default"}
 * ]
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RoutingRules {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<RoutingRule> rules;

    private RoutingRules(List<RoutingRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = List.copyOf(rules);
    }

    public static RoutingRules of(List<RoutingRule> rules) {
        return new RoutingRules(rules);
    }

    public static RoutingRules of(RoutingRule... rules) {
        return new RoutingRules(List.of(rules));
    }

    /**
     * JSON 문서로부터 규칙 목록 생성.
     *
     * @param json 규칙 배열 JSON
     * @return RoutingRules
     * @throws IllegalArgumentException JSON이 유효하지 않거나 필수 필드가 없는 경우
     */
    public static RoutingRules fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid routing rules JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Routing rules must be a JSON array");
        }

        List<RoutingRule> parsed = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            JsonNode target = node.get("target_prefix");
            if (target == null || !target.isTextual()) {
                throw new IllegalArgumentException("Routing rule #" + i + " lacks a textual target_prefix");
            }
            JsonNode match = node.path("match");
            if (!match.isMissingNode() && !match.isObject()) {
                throw new IllegalArgumentException("Routing rule #" + i + " has a non-object match");
            }
            RulePredicate predicate = new RulePredicate(
                text(match, "arch"),
                text(match, "os_tag"),
                text(match, "format")
            );
            parsed.add(new RoutingRule(predicate, target.asText()));
        }
        return new RoutingRules(parsed);
    }

    private static String text(JsonNode match, String field) {
        JsonNode value = match.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * 첫 번째로 매칭되는 규칙 조회.
     *
     * @param descriptor 패키지 디스크립터
     * @return 매칭된 규칙 (없으면 empty)
     */
    public Optional<RoutingRule> firstMatch(PackageDescriptor descriptor) {
        return rules.stream().filter(rule -> rule.matches(descriptor)).findFirst();
    }

    public List<RoutingRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "RoutingRules{" + rules + "}";
    }
}

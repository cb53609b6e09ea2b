package com.ryuqq.repoup.core.routing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RoutingRules JSON 파싱 테스트.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class RoutingRulesTest {

    @Test
    void fromJson_순서와_필드_보존() {
        // given
        String json = """
            [
              {"match": {"arch": "aarch64"}, "target_prefix": "/arm"},
              {"match": {"arch": "*", "os_tag": "el8", "format": "rpm"}, "target_prefix": "/el8"},
              {"target_prefix": "/default"}
            ]
            """;

        // when
        RoutingRules rules = RoutingRules.fromJson(json);

        // then
        assertThat(rules.getRules()).containsExactly(
            new RoutingRule(new RulePredicate("aarch64", null, null), "/arm"),
            new RoutingRule(new RulePredicate("*", "el8", "rpm"), "/el8"),
            new RoutingRule(new RulePredicate(null, null, null), "/default")
        );
    }

    @Test
    void fromJson_배열이_아니면_거부() {
        assertThatThrownBy(() -> RoutingRules.fromJson("{\"target_prefix\": \"/a\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("array");
    }

    @Test
    void fromJson_target_prefix_누락시_거부() {
        assertThatThrownBy(() -> RoutingRules.fromJson("[{\"match\": {\"arch\": \"x86_64\"}}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#0");
    }

    @Test
    void fromJson_잘못된_JSON_거부() {
        assertThatThrownBy(() -> RoutingRules.fromJson("[{"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid routing rules JSON");
    }
}

package com.ryuqq.repoup.core.routing;

import com.ryuqq.repoup.core.error.NoMatchingRepositoryException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RepositoryLocator 테스트.
 *
 * <ul>
 *   <li>첫 번째 매칭 규칙 적용 (aarch64 → /arm, 나머지 → /default)</li>
 *   <li>매칭 규칙이 없으면 NoMatchingRepository</li>
 *   <li>target_prefix 템플릿 변수 치환</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class RepositoryLocatorTest {

    private static PackageDescriptor descriptor(String arch, String osTag, PackageFormat format) {
        return new PackageDescriptor("foo", "1.0", osTag == null ? "1" : "1." + osTag, arch, osTag, format,
            ContentHash.sha256(arch.getBytes()));
    }

    @Test
    void resolve_첫_번째_매칭_규칙이_적용됨() {
        // given
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(RulePredicate.arch("aarch64"), "/arm"),
            new RoutingRule(RulePredicate.arch("*"), "/default")
        ));

        // when & then
        assertThat(locator.resolve(descriptor("aarch64", null, PackageFormat.RPM))).isEqualTo(RepositoryPrefix.of("/arm"));
        assertThat(locator.resolve(descriptor("x86_64", "el8", PackageFormat.RPM))).isEqualTo(RepositoryPrefix.of("/default"));
        assertThat(locator.resolve(descriptor("noarch", null, PackageFormat.RPM)).getValue()).isEqualTo("/default");
    }

    @Test
    void resolve_매칭_규칙_없으면_NoMatchingRepository() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(new RulePredicate("x86_64", "el*", "rpm"), "/el")
        ));

        assertThatThrownBy(() -> locator.resolve(descriptor("x86_64", null, PackageFormat.RPM)))
            .isInstanceOf(NoMatchingRepositoryException.class)
            .hasMessageContaining("foo-1.0-1.x86_64");
        assertThatThrownBy(() -> locator.resolve(descriptor("x86_64", "el9", PackageFormat.DEB)))
            .isInstanceOf(NoMatchingRepositoryException.class);
    }

    @Test
    void resolve_glob과_대소문자_무시_매칭() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(new RulePredicate("X86_?4", "el*", null), "/el")
        ));

        assertThat(locator.resolve(descriptor("x86_64", "el9", PackageFormat.RPM)).getValue()).isEqualTo("/el");
    }

    @Test
    void resolve_템플릿_변수_치환() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(RulePredicate.any(), "/$format/el$releasever/$basearch")
        ));

        RepositoryPrefix prefix = locator.resolve(descriptor("x86_64", "el8", PackageFormat.RPM));

        assertThat(prefix.getValue()).isEqualTo("/rpm/el8/x86_64");
    }

    @Test
    void resolve_호출자_변수_치환() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(RulePredicate.any(), "/$channel/$arch")
        ));

        RepositoryPrefix prefix = locator.resolve(descriptor("aarch64", null, PackageFormat.RPM), Map.of("channel", "stable"));

        assertThat(prefix.getValue()).isEqualTo("/stable/aarch64");
    }

    @Test
    void resolve_패키지_값이_같은_이름의_호출자_변수보다_우선() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(RulePredicate.any(), "/$channel/el$releasever/$basearch")
        ));

        RepositoryPrefix prefix = locator.resolve(descriptor("x86_64", "el8", PackageFormat.RPM),
            Map.of("channel", "stable", "basearch", "aarch64", "arch", "aarch64", "releasever", "9"));

        assertThat(prefix.getValue()).isEqualTo("/stable/el8/x86_64");
    }

    @Test
    void resolve_치환되지_않은_변수는_NoMatchingRepository() {
        RepositoryLocator locator = new RepositoryLocator(RoutingRules.of(
            new RoutingRule(RulePredicate.any(), "/el$releasever")
        ));

        assertThatThrownBy(() -> locator.resolve(descriptor("x86_64", null, PackageFormat.RPM)))
            .isInstanceOf(NoMatchingRepositoryException.class)
            .hasMessageContaining("$releasever");
    }
}

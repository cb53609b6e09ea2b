package com.ryuqq.repoup.core.routing;

import com.ryuqq.repoup.core.model.PackageDescriptor;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 라우팅 규칙의 매칭 조건 (architecture, os_tag, format).
 *
 * <p>각 필드는 glob 패턴({@code *}, {@code ?})이며 null 또는 {@code *}는 모든 값과 매칭됩니다.
 * 매칭은 대소문자를 구분하지 않습니다. os_tag가 없는 패키지는 os_tag 조건이
 * 와일드카드일 때만 매칭됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param arch architecture glob (예: "aarch64", "x86_*")
 * @param osTag os_tag glob (예: "el8", "el*")
 * @param format format glob (예: "rpm")
 */
public record RulePredicate(String arch, String osTag, String format) {

    private static final String ANY = "*";

    /**
     * 모든 패키지와 매칭되는 조건.
     *
     * @return wildcard predicate
     */
    public static RulePredicate any() {
        return new RulePredicate(null, null, null);
    }

    /**
     * architecture만 지정한 조건.
     *
     * @param arch architecture glob
     * @return predicate
     */
    public static RulePredicate arch(String arch) {
        return new RulePredicate(arch, null, null);
    }

    /**
     * 디스크립터 매칭 여부.
     *
     * @param descriptor 패키지 디스크립터
     * @return 모든 조건을 만족하면 true
     */
    public boolean matches(PackageDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        return globMatches(arch, descriptor.architecture())
            && globMatches(osTag, descriptor.osTag())
            && globMatches(format, descriptor.format().extension());
    }

    static boolean globMatches(String glob, String value) {
        if (glob == null || glob.isBlank() || ANY.equals(glob.trim())) {
            return true;
        }
        if (value == null) {
            return false;
        }
        return toRegex(glob.trim()).matcher(value.toLowerCase(Locale.ROOT)).matches();
    }

    private static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}

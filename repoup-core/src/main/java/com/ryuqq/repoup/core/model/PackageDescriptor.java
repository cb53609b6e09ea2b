package com.ryuqq.repoup.core.model;

/**
 * 패키지 식별 정보.
 *
 * <p>패키지 아티팩트의 파일 이름 및 헤더로부터 계산되며, 한 번 계산된 후에는 변경되지 않습니다.
 * 라우팅(어느 저장소로 보낼지)과 멱등성 판단(contentHash)에 사용됩니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>name, version, release, architecture: 패키지 포맷의 표준 식별자</li>
 *   <li>osTag: 배포판 태그 (예: RPM release "1.el8"의 "el8"), 없으면 null</li>
 *   <li>format: 패키지 포맷</li>
 *   <li>contentHash: 아티팩트 바이트의 SHA-256</li>
 * </ul>
 *
 * @param name 패키지 이름
 * @param version 버전 (epoch가 있으면 "epoch:version" 형식)
 * @param release 릴리스 (DEB는 revision, 없으면 빈 문자열)
 * @param architecture 아키텍처 (예: x86_64, aarch64, noarch)
 * @param osTag 배포판 태그 (null 허용)
 * @param format 패키지 포맷
 * @param contentHash 콘텐츠 해시
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record PackageDescriptor(
    String name,
    String version,
    String release,
    String architecture,
    String osTag,
    PackageFormat format,
    ContentHash contentHash
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public PackageDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        if (release == null) {
            throw new IllegalArgumentException("release cannot be null");
        }
        if (architecture == null || architecture.isBlank()) {
            throw new IllegalArgumentException("architecture cannot be null or blank");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        if (contentHash == null) {
            throw new IllegalArgumentException("contentHash cannot be null");
        }
        if (osTag != null && osTag.isBlank()) {
            osTag = null;
        }
    }

    /**
     * 포맷 독립적인 패키지 신원 (콘텐츠 해시 제외).
     *
     * <p>같은 신원이지만 콘텐츠 해시가 다른 두 패키지는 충돌로 간주됩니다.</p>
     *
     * @return "name-version-release.arch" 형식 문자열
     */
    public String identity() {
        String base = release.isEmpty() ? name + "-" + version : name + "-" + version + "-" + release;
        return base + "." + architecture;
    }

    /**
     * osTag에서 숫자 부분만 추출한 배포판 버전 (예: "el8" → "8", "fc39" → "39").
     *
     * @return releasever 또는 osTag가 없으면 null
     */
    public String releasever() {
        if (osTag == null) {
            return null;
        }
        int i = 0;
        while (i < osTag.length() && Character.isLetter(osTag.charAt(i))) {
            i++;
        }
        String stripped = osTag.substring(i);
        return stripped.isEmpty() ? null : stripped;
    }

    /**
     * 콘텐츠 주소 기반 아티팩트 파일 이름.
     *
     * @return "&lt;contentHash&gt;.&lt;ext&gt;"
     */
    public String artifactFilename() {
        return contentHash.getValue() + "." + format.extension();
    }
}

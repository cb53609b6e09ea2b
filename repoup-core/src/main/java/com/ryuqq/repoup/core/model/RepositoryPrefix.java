package com.ryuqq.repoup.core.model;

/**
 * 저장소를 식별하는 오브젝트 스토리지 prefix.
 *
 * <p>표시용 값(예: "/arm")은 그대로 유지하고, 스토리지 키 생성 시에는
 * 앞뒤 슬래시를 제거한 형태를 사용합니다. 동등성과 정렬은 스토리지 키 기준이므로
 * "/arm"과 "arm"은 같은 저장소입니다.</p>
 *
 * <p><strong>저장소 레이아웃:</strong></p>
 * <pre>
 * &lt;prefix&gt;/packages/&lt;content_hash&gt;.&lt;ext&gt;    패키지 아티팩트
 * &lt;prefix&gt;/metadata/&lt;component&gt;-&lt;digest&gt;.&lt;ext&gt; 인덱스 컴포넌트
 * &lt;prefix&gt;/metadata/manifest                  매니페스트 (항상 덮어씀)
 * &lt;prefix&gt;/lock                               lease 오브젝트
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RepositoryPrefix implements Comparable<RepositoryPrefix> {

    public static final String PACKAGES_DIR = "packages";
    public static final String METADATA_DIR = "metadata";
    public static final String MANIFEST_NAME = "manifest";
    public static final String LOCK_NAME = "lock";

    private final String value;
    private final String keyBase;

    private RepositoryPrefix(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RepositoryPrefix cannot be null or blank");
        }
        String trimmed = value.trim();
        if (trimmed.contains("//") || trimmed.contains("..")) {
            throw new IllegalArgumentException("RepositoryPrefix contains invalid path segments: " + value);
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.value = trimmed;
        this.keyBase = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    }

    /**
     * RepositoryPrefix 생성.
     *
     * @param value prefix 값 (예: "/arm", "rpm/el8/x86_64")
     * @return RepositoryPrefix 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RepositoryPrefix of(String value) {
        return new RepositoryPrefix(value);
    }

    /**
     * 매니페스트 키로부터 prefix 복원 (저장소 탐색용).
     *
     * @param manifestKey "&lt;keyBase&gt;/metadata/manifest" 형식 키
     * @return RepositoryPrefix
     * @throws IllegalArgumentException 매니페스트 키 형식이 아닌 경우
     */
    public static RepositoryPrefix fromManifestKey(String manifestKey) {
        String suffix = METADATA_DIR + "/" + MANIFEST_NAME;
        if (manifestKey == null || !manifestKey.endsWith(suffix)) {
            throw new IllegalArgumentException("Not a manifest key: " + manifestKey);
        }
        String base = manifestKey.substring(0, manifestKey.length() - suffix.length());
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return new RepositoryPrefix(base.isEmpty() ? "/" : base);
    }

    public String getValue() {
        return value;
    }

    /**
     * prefix 하위 상대 경로를 스토리지 키로 변환.
     *
     * @param relativePath 상대 경로 (예: "metadata/manifest")
     * @return 스토리지 키
     */
    public String key(String relativePath) {
        return keyBase.isEmpty() ? relativePath : keyBase + "/" + relativePath;
    }

    public String manifestKey() {
        return key(METADATA_DIR + "/" + MANIFEST_NAME);
    }

    public String lockKey() {
        return key(LOCK_NAME);
    }

    public String packageKey(PackageDescriptor descriptor) {
        return key(PACKAGES_DIR + "/" + descriptor.artifactFilename());
    }

    public String metadataKey(String filename) {
        return key(METADATA_DIR + "/" + filename);
    }

    /**
     * 저장소 루트 디렉터리 키 (CDN 캐시 무효화용, 끝에 슬래시 포함).
     *
     * @return 루트 키
     */
    public String rootKey() {
        return keyBase.isEmpty() ? "" : keyBase + "/";
    }

    @Override
    public int compareTo(RepositoryPrefix other) {
        return keyBase.compareTo(other.keyBase);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RepositoryPrefix that = (RepositoryPrefix) o;
        return keyBase.equals(that.keyBase);
    }

    @Override
    public int hashCode() {
        return keyBase.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.core.model.PackageFormat;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 저장소 매니페스트 ({@code <prefix>/metadata/manifest}).
 *
 * <p>리더가 가장 먼저 읽는 유일한 고정 경로 오브젝트입니다. 참조하는 모든 컴포넌트는
 * 매니페스트보다 먼저 기록되므로, 리더는 항상 완전한 이전 상태 또는 완전한 새 상태를 봅니다.</p>
 *
 * <p>서명은 매니페스트 바이트의 다이제스트로 주소가 정해지는 별도 오브젝트
 * ({@code manifest-<digest>.asc})에 저장됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param format 패키지 포맷 확장자 ("rpm", "deb")
 * @param metadataVersion 게시마다 1씩 증가하는 버전
 * @param publishedAt 게시 시각
 * @param components 참조 컴포넌트 (role 순 정렬)
 */
public record RepositoryManifest(
    String format,
    long metadataVersion,
    Instant publishedAt,
    List<ManifestComponent> components
) {

    /** 엔진이 관리하는 패키지 인덱스 컴포넌트 role. */
    public static final String PACKAGE_INDEX_ROLE = "packages";

    public RepositoryManifest {
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("format cannot be null or blank");
        }
        if (metadataVersion <= 0) {
            throw new IllegalArgumentException("metadataVersion must be positive (current: " + metadataVersion + ")");
        }
        if (publishedAt == null) {
            throw new IllegalArgumentException("publishedAt cannot be null");
        }
        components = components == null ? List.of() : List.copyOf(components);
    }

    public PackageFormat packageFormat() {
        return PackageFormat.of(format);
    }

    /**
     * role로 컴포넌트 조회.
     *
     * @param role 컴포넌트 role
     * @return 컴포넌트 (없으면 empty)
     */
    public Optional<ManifestComponent> component(String role) {
        return components.stream().filter(component -> component.role().equals(role)).findFirst();
    }

    public List<String> componentKeys() {
        return components.stream().map(ManifestComponent::key).toList();
    }
}

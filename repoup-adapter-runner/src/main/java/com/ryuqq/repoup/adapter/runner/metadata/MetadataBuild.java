package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.core.model.IndexedPackage;

import java.util.Comparator;
import java.util.List;

/**
 * MetadataBuilder 결과: 업데이트 후 패키지 집합과 그 전체 인덱스 컴포넌트.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param packages 업데이트 후 패키지 (해시 정렬)
 * @param components 컴포넌트 (role 정렬, 패키지 인덱스 포함)
 */
public record MetadataBuild(
    List<IndexedPackage> packages,
    List<StagedComponent> components
) {

    public MetadataBuild {
        if (packages == null) {
            throw new IllegalArgumentException("packages cannot be null");
        }
        if (components == null) {
            throw new IllegalArgumentException("components cannot be null");
        }
        packages = List.copyOf(packages);
        components = components.stream().sorted(Comparator.comparing(StagedComponent::role)).toList();
    }

    public List<ManifestComponent> manifestComponents() {
        return components.stream().map(StagedComponent::toManifestComponent).toList();
    }
}

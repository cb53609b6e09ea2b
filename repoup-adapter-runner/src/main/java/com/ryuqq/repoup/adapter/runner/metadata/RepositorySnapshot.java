package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.VersionToken;

import java.util.List;
import java.util.Optional;

/**
 * 특정 시점에 읽은 저장소 상태.
 *
 * <p>{@code manifest}가 null이면 아직 초기화되지 않은 저장소입니다.
 * {@code manifestVersion}은 게시 시 조건부 put의 기대 토큰으로 사용됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record RepositorySnapshot(
    RepositoryPrefix prefix,
    RepositoryManifest manifest,
    VersionToken manifestVersion,
    byte[] manifestBytes,
    List<IndexedPackage> packages
) {

    public RepositorySnapshot {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    public static RepositorySnapshot uninitialized(RepositoryPrefix prefix) {
        return new RepositorySnapshot(prefix, null, null, null, List.of());
    }

    public boolean isInitialized() {
        return manifest != null;
    }

    /**
     * @return 저장소 포맷 (초기화되지 않았으면 empty)
     */
    public Optional<PackageFormat> format() {
        return manifest == null ? Optional.empty() : Optional.of(manifest.packageFormat());
    }

    public long metadataVersion() {
        return manifest == null ? 0L : manifest.metadataVersion();
    }

    public Optional<IndexedPackage> findByHash(ContentHash hash) {
        return packages.stream().filter(indexed -> indexed.contentHash().equals(hash)).findFirst();
    }

    /**
     * 같은 identity (name-version-release.arch)의 패키지 조회.
     */
    public Optional<IndexedPackage> findByIdentity(String identity) {
        return packages.stream().filter(indexed -> indexed.descriptor().identity().equals(identity)).findFirst();
    }

    /**
     * 현재 매니페스트가 참조하는 오브젝트 키인지 확인.
     */
    public boolean references(String key) {
        return manifest != null && manifest.componentKeys().contains(key);
    }
}

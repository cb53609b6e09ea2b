package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.MetadataComponent;
import com.ryuqq.repoup.core.spi.MetadataGenerator;
import com.ryuqq.repoup.core.spi.MetadataRequest;
import com.ryuqq.repoup.core.spi.PackageContentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 외부 메타데이터 생성기를 감싸는 빌더.
 *
 * <p>항상 업데이트 후의 전체 패키지 집합으로 생성기를 호출하므로, 결과는 이전 인덱스에
 * 의존하지 않는 완전한 인덱스입니다. 컴포넌트 키는 내용 다이제스트를 포함하므로
 * 같은 패키지 집합은 항상 같은 키를 만듭니다.</p>
 *
 * <p>이 단계는 스토리지에 아무것도 쓰지 않습니다. 생성기 실패는 모두
 * {@link MetadataBuildFailedException}으로 변환됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class MetadataBuilder {

    private static final Logger log = LoggerFactory.getLogger(MetadataBuilder.class);

    private static final String PACKAGE_INDEX_EXTENSION = "json";

    private final MetadataGenerator generator;

    public MetadataBuilder(MetadataGenerator generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        this.generator = generator;
    }

    /**
     * 새 인덱스 계산.
     *
     * @param snapshot 현재 저장소 상태
     * @param format 저장소 포맷
     * @param added 추가할 패키지 (같은 해시는 교체)
     * @param removed 제거할 해시
     * @param contentSource 생성기가 패키지 바이트를 읽는 소스
     * @return 새 패키지 집합과 컴포넌트
     * @throws MetadataBuildFailedException 생성기가 실패했거나 잘못된 컴포넌트를 돌려준 경우
     */
    public MetadataBuild build(
        RepositorySnapshot snapshot,
        PackageFormat format,
        Collection<IndexedPackage> added,
        Collection<ContentHash> removed,
        PackageContentSource contentSource
    ) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        if (contentSource == null) {
            throw new IllegalArgumentException("contentSource cannot be null");
        }

        List<IndexedPackage> packages = merge(snapshot.packages(), added, removed);
        RepositoryPrefix prefix = snapshot.prefix();

        List<MetadataComponent> generated;
        try {
            generated = generator.generate(new MetadataRequest(prefix, format, packages, contentSource));
        } catch (MetadataBuildFailedException | UpdateTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MetadataBuildFailedException("Metadata generation failed for " + prefix + ": " + e.getMessage(), e);
        }
        if (generated == null) {
            throw new MetadataBuildFailedException("Metadata generator returned no components for " + prefix);
        }

        List<StagedComponent> components = new ArrayList<>();
        Set<String> roles = new HashSet<>();
        for (MetadataComponent component : generated) {
            String role = component.name();
            if (role.equals(RepositoryManifest.PACKAGE_INDEX_ROLE) || role.startsWith(RepositoryPrefix.MANIFEST_NAME)) {
                throw new MetadataBuildFailedException("Metadata component name is reserved: " + role);
            }
            if (!roles.add(role)) {
                throw new MetadataBuildFailedException("Duplicate metadata component: " + role);
            }
            components.add(stage(prefix, role, component.extension(), component.content()));
        }
        components.add(stage(prefix, RepositoryManifest.PACKAGE_INDEX_ROLE, PACKAGE_INDEX_EXTENSION,
            PackageIndexCodec.encode(packages)));

        log.debug("Built {} metadata components for {} ({} packages)", components.size(), prefix, packages.size());
        return new MetadataBuild(packages, components);
    }

    private static List<IndexedPackage> merge(
        List<IndexedPackage> current,
        Collection<IndexedPackage> added,
        Collection<ContentHash> removed
    ) {
        Map<ContentHash, IndexedPackage> byHash = new LinkedHashMap<>();
        for (IndexedPackage indexed : current) {
            byHash.put(indexed.contentHash(), indexed);
        }
        if (removed != null) {
            for (ContentHash hash : removed) {
                byHash.remove(hash);
            }
        }
        if (added != null) {
            for (IndexedPackage indexed : added) {
                byHash.put(indexed.contentHash(), indexed);
            }
        }
        return byHash.values().stream()
            .sorted(Comparator.comparing(indexed -> indexed.contentHash().getValue()))
            .toList();
    }

    private static StagedComponent stage(RepositoryPrefix prefix, String role, String extension, byte[] content) {
        String digest = ContentHash.sha256(content).getValue();
        String key = prefix.metadataKey(role + "-" + digest + "." + extension);
        return new StagedComponent(role, key, digest, content);
    }
}

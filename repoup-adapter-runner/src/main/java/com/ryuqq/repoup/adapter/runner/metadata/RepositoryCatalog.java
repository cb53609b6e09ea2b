package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 스토리지에서 저장소 상태를 읽는 리더.
 *
 * <p>매니페스트 → 패키지 인덱스 순으로 읽습니다. 매니페스트가 가리키는 인덱스가 없으면
 * 저장소가 손상된 것이므로 MetadataBuildFailed로 보고합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class RepositoryCatalog {

    private static final Logger log = LoggerFactory.getLogger(RepositoryCatalog.class);

    private static final String MANIFEST_SUFFIX = RepositoryPrefix.METADATA_DIR + "/" + RepositoryPrefix.MANIFEST_NAME;

    private final ObjectStorage storage;

    public RepositoryCatalog(ObjectStorage storage) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.storage = storage;
    }

    /**
     * 저장소 스냅샷 읽기.
     *
     * @param prefix 저장소 prefix
     * @return 스냅샷 (매니페스트가 없으면 uninitialized)
     * @throws MetadataBuildFailedException 매니페스트/인덱스를 해석할 수 없는 경우
     */
    public RepositorySnapshot snapshot(RepositoryPrefix prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        StoredObject manifestObject;
        try {
            manifestObject = storage.get(prefix.manifestKey());
        } catch (ObjectNotFoundException e) {
            log.debug("Repository {} has no manifest", prefix);
            return RepositorySnapshot.uninitialized(prefix);
        }

        RepositoryManifest manifest = ManifestCodec.decode(manifestObject.content());
        List<IndexedPackage> packages = manifest.component(RepositoryManifest.PACKAGE_INDEX_ROLE)
            .map(component -> readIndex(component.key()))
            .orElse(List.of());

        return new RepositorySnapshot(prefix, manifest, manifestObject.version(), manifestObject.content(), packages);
    }

    private List<IndexedPackage> readIndex(String key) {
        try {
            return PackageIndexCodec.decode(storage.get(key).content());
        } catch (ObjectNotFoundException e) {
            throw new MetadataBuildFailedException(
                "Manifest references a missing package index: " + key, e);
        }
    }

    /**
     * 스토리지의 모든 저장소 탐색 ({@code metadata/manifest}로 끝나는 키).
     *
     * @return prefix 정렬 목록
     */
    public List<RepositoryPrefix> discover() {
        return storage.list("").stream()
            .filter(key -> key.equals(MANIFEST_SUFFIX) || key.endsWith("/" + MANIFEST_SUFFIX))
            .map(RepositoryPrefix::fromManifestKey)
            .sorted()
            .toList();
    }

    /**
     * 해시별로 패키지가 인덱싱된 저장소를 찾습니다.
     *
     * @param hashes 찾을 해시
     * @return 해시 → 저장소 목록 (입력 순서 유지, 어디에도 없으면 빈 목록)
     */
    public Map<ContentHash, List<RepositoryPrefix>> locate(Collection<ContentHash> hashes) {
        Map<ContentHash, List<RepositoryPrefix>> located = new LinkedHashMap<>();
        for (ContentHash hash : hashes) {
            located.put(hash, new ArrayList<>());
        }
        for (RepositoryPrefix prefix : discover()) {
            RepositorySnapshot snapshot = snapshot(prefix);
            for (Map.Entry<ContentHash, List<RepositoryPrefix>> entry : located.entrySet()) {
                Optional<IndexedPackage> found = snapshot.findByHash(entry.getKey());
                if (found.isPresent()) {
                    entry.getValue().add(prefix);
                }
            }
        }
        return located;
    }
}

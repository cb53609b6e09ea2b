package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.adapter.inmemory.storage.InMemoryObjectStorage;
import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.spi.Precondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RepositoryCatalog 유닛 테스트.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class RepositoryCatalogTest {

    private InMemoryObjectStorage storage;
    private RepositoryCatalog catalog;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
        catalog = new RepositoryCatalog(storage);
    }

    private static IndexedPackage indexed(RepositoryPrefix prefix, String name) {
        ContentHash hash = ContentHash.sha256(name.getBytes(StandardCharsets.UTF_8));
        PackageDescriptor descriptor = new PackageDescriptor(name, "1.0", "1", "x86_64", null, PackageFormat.RPM, hash);
        return new IndexedPackage(descriptor, prefix.packageKey(descriptor));
    }

    private void publish(RepositoryPrefix prefix, List<IndexedPackage> packages) {
        byte[] index = PackageIndexCodec.encode(packages);
        String digest = ContentHash.sha256(index).getValue();
        String indexKey = prefix.metadataKey("packages-" + digest + ".json");
        storage.put(indexKey, index, Precondition.none());
        RepositoryManifest manifest = new RepositoryManifest("rpm", 1, Instant.parse("2024-05-01T10:00:00Z"),
            List.of(new ManifestComponent(RepositoryManifest.PACKAGE_INDEX_ROLE, indexKey, digest, index.length)));
        storage.put(prefix.manifestKey(), ManifestCodec.encode(manifest), Precondition.none());
    }

    @Test
    void 매니페스트가_없으면_초기화되지_않은_스냅샷() {
        // when
        RepositorySnapshot snapshot = catalog.snapshot(RepositoryPrefix.of("/empty"));

        // then
        assertThat(snapshot.isInitialized()).isFalse();
        assertThat(snapshot.manifestVersion()).isNull();
        assertThat(snapshot.packages()).isEmpty();
        assertThat(snapshot.format()).isEmpty();
    }

    @Test
    void 매니페스트와_패키지_인덱스를_읽음() {
        // given
        RepositoryPrefix prefix = RepositoryPrefix.of("/default");
        IndexedPackage foo = indexed(prefix, "foo");
        publish(prefix, List.of(foo));

        // when
        RepositorySnapshot snapshot = catalog.snapshot(prefix);

        // then
        assertThat(snapshot.isInitialized()).isTrue();
        assertThat(snapshot.format()).contains(PackageFormat.RPM);
        assertThat(snapshot.metadataVersion()).isEqualTo(1);
        assertThat(snapshot.manifestVersion()).isEqualTo(storage.get(prefix.manifestKey()).version());
        assertThat(snapshot.packages()).containsExactly(foo);
        assertThat(snapshot.findByHash(foo.contentHash())).contains(foo);
        assertThat(snapshot.findByIdentity("foo-1.0-1.x86_64")).contains(foo);
    }

    @Test
    void 참조된_인덱스가_없으면_MetadataBuildFailed() {
        // given
        RepositoryPrefix prefix = RepositoryPrefix.of("/broken");
        publish(prefix, List.of(indexed(prefix, "foo")));
        storage.list("broken/metadata/packages-").forEach(storage::delete);

        // when & then
        assertThatThrownBy(() -> catalog.snapshot(prefix))
            .isInstanceOf(MetadataBuildFailedException.class)
            .hasMessageContaining("missing package index");
    }

    @Test
    void 손상된_매니페스트는_MetadataBuildFailed() {
        // given
        RepositoryPrefix prefix = RepositoryPrefix.of("/corrupt");
        storage.put(prefix.manifestKey(), "{not json".getBytes(StandardCharsets.UTF_8), Precondition.none());

        // when & then
        assertThatThrownBy(() -> catalog.snapshot(prefix))
            .isInstanceOf(MetadataBuildFailedException.class);
    }

    @Test
    void 매니페스트_키로_저장소를_탐색() {
        // given
        publish(RepositoryPrefix.of("/el8/x86_64"), List.of());
        publish(RepositoryPrefix.of("/arm"), List.of());
        storage.put("arm/packages/stray.rpm", new byte[]{1}, Precondition.none());

        // when
        List<RepositoryPrefix> prefixes = catalog.discover();

        // then
        assertThat(prefixes).containsExactly(RepositoryPrefix.of("/arm"), RepositoryPrefix.of("/el8/x86_64"));
    }

    @Test
    void 해시가_인덱싱된_모든_저장소를_찾음() {
        // given
        RepositoryPrefix arm = RepositoryPrefix.of("/arm");
        RepositoryPrefix x86 = RepositoryPrefix.of("/x86");
        IndexedPackage shared = indexed(arm, "shared");
        publish(arm, List.of(shared));
        publish(x86, List.of(indexed(x86, "shared"), indexed(x86, "only-x86")));
        ContentHash missing = ContentHash.sha256(new byte[]{42});

        // when
        Map<ContentHash, List<RepositoryPrefix>> located = catalog.locate(List.of(shared.contentHash(), missing));

        // then
        assertThat(located.get(shared.contentHash())).containsExactly(arm, x86);
        assertThat(located.get(missing)).isEmpty();
    }
}

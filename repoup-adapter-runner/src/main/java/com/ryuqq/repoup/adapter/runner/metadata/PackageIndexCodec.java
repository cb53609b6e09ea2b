package com.ryuqq.repoup.adapter.runner.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ryuqq.repoup.adapter.runner.json.RepoupJson;
import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;

/**
 * Engine-owned package index component ({@code packages-<digest>.json}).
 *
 * <p>Entries are sorted by content hash so an unchanged package set always encodes to the same
 * bytes and therefore the same component key.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class PackageIndexCodec {

    private static final TypeReference<List<Entry>> ENTRY_LIST = new TypeReference<>() { };

    private PackageIndexCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static byte[] encode(List<IndexedPackage> packages) {
        List<Entry> entries = packages.stream()
            .sorted(Comparator.comparing(indexed -> indexed.contentHash().getValue()))
            .map(Entry::from)
            .toList();
        try {
            return RepoupJson.mapper().writeValueAsBytes(entries);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode package index", e);
        }
    }

    /**
     * 패키지 인덱스 디코딩.
     *
     * @param content 인덱스 바이트
     * @return 인덱스 항목
     * @throws MetadataBuildFailedException 인덱스를 해석할 수 없는 경우
     */
    public static List<IndexedPackage> decode(byte[] content) {
        try {
            List<Entry> entries = RepoupJson.mapper().readValue(content, ENTRY_LIST);
            return entries.stream().map(Entry::toIndexedPackage).toList();
        } catch (IOException | IllegalArgumentException e) {
            throw new MetadataBuildFailedException("Unreadable package index: " + e.getMessage(), e);
        }
    }

    record Entry(
        String name,
        String version,
        String release,
        String architecture,
        String osTag,
        String format,
        String contentHash,
        String objectKey
    ) {

        static Entry from(IndexedPackage indexed) {
            PackageDescriptor descriptor = indexed.descriptor();
            return new Entry(
                descriptor.name(),
                descriptor.version(),
                descriptor.release(),
                descriptor.architecture(),
                descriptor.osTag(),
                descriptor.format().extension(),
                descriptor.contentHash().getValue(),
                indexed.objectKey()
            );
        }

        IndexedPackage toIndexedPackage() {
            PackageDescriptor descriptor = new PackageDescriptor(
                name,
                version,
                release == null ? "" : release,
                architecture,
                osTag,
                PackageFormat.of(format),
                ContentHash.of(contentHash)
            );
            return new IndexedPackage(descriptor, objectKey);
        }
    }
}

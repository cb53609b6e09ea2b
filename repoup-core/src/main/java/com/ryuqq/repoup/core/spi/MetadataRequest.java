package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;

import java.util.List;

/**
 * Input of a metadata generation: the complete post-update package set of one repository.
 *
 * @param prefix destination repository
 * @param format repository format
 * @param packages full package list after the update, sorted by content hash (may be empty)
 * @param contentSource access to package bytes
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record MetadataRequest(
    RepositoryPrefix prefix,
    PackageFormat format,
    List<IndexedPackage> packages,
    PackageContentSource contentSource
) {

    public MetadataRequest {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        if (packages == null) {
            throw new IllegalArgumentException("packages cannot be null");
        }
        if (contentSource == null) {
            throw new IllegalArgumentException("contentSource cannot be null");
        }
        packages = List.copyOf(packages);
    }
}

package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.model.IndexedPackage;

/**
 * Gives a metadata generator access to the (signed) bytes of an indexed package.
 *
 * <p>Staged packages are served from memory; already published packages are read from storage.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PackageContentSource {

    /**
     * Reads the bytes of a package.
     *
     * @param indexedPackage package to read
     * @return artifact bytes
     */
    byte[] read(IndexedPackage indexedPackage);
}

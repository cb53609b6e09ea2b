package com.ryuqq.repoup.core.spi;

import java.util.List;

/**
 * CDN cache invalidation hook, called after a new manifest is published.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CacheInvalidator {

    /**
     * Invalidates cached copies of the given storage paths.
     *
     * @param paths storage keys; entries ending with '/' denote directory listings
     */
    void invalidate(List<String> paths);

    static CacheInvalidator noOp() {
        return paths -> { };
    }
}

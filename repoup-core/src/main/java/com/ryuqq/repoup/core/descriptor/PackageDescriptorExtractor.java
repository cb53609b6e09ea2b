package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.error.MalformedPackageException;
import com.ryuqq.repoup.core.model.PackageArtifact;

/**
 * Computes a package's identity from its file name and, where the format embeds one, its header.
 *
 * <p>Pure function: no I/O and no shared mutable state, so one instance may serve many
 * concurrent resolutions.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public interface PackageDescriptorExtractor {

    /**
     * Whether this extractor handles the given file name.
     *
     * @param filename package file name
     * @return true if supported
     */
    boolean supports(String filename);

    /**
     * Extracts the descriptor.
     *
     * @param artifact package artifact
     * @return descriptor plus non-fatal mismatches
     * @throws MalformedPackageException if required fields cannot be determined
     */
    ExtractionResult extract(PackageArtifact artifact);
}

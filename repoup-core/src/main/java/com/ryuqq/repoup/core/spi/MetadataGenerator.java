package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.error.MetadataBuildFailedException;

import java.util.List;

/**
 * External repository-metadata generation capability (createrepo_c, apt-ftparchive, ...).
 *
 * <p>Modelled as a pure function: package set in, index components out. The engine owns
 * storage layout, manifest, signing and publication, so a generator never writes to storage.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Idempotent: the same package set yields the same components</li>
 *   <li>Must accept an empty package set (repository initialization)</li>
 *   <li>Always a full index, never an incremental patch against a previous one</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetadataGenerator {

    /**
     * Generates the format-specific index components.
     *
     * @param request package set and destination
     * @return generated components (may be empty when the format needs none)
     * @throws MetadataBuildFailedException if generation fails
     */
    List<MetadataComponent> generate(MetadataRequest request);
}

package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.error.MalformedPackageException;
import com.ryuqq.repoup.core.model.PackageArtifact;

import java.util.List;

/**
 * Dispatches to the first extractor supporting the artifact's file name.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class DescriptorExtractors implements PackageDescriptorExtractor {

    private final List<PackageDescriptorExtractor> extractors;

    public DescriptorExtractors(List<PackageDescriptorExtractor> extractors) {
        if (extractors == null || extractors.isEmpty()) {
            throw new IllegalArgumentException("extractors cannot be null or empty");
        }
        this.extractors = List.copyOf(extractors);
    }

    /**
     * RPM + DEB extractors.
     *
     * @return default extractor chain
     */
    public static DescriptorExtractors defaults() {
        return new DescriptorExtractors(List.of(new RpmDescriptorExtractor(), new DebDescriptorExtractor()));
    }

    @Override
    public boolean supports(String filename) {
        return extractors.stream().anyMatch(extractor -> extractor.supports(filename));
    }

    @Override
    public ExtractionResult extract(PackageArtifact artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        for (PackageDescriptorExtractor extractor : extractors) {
            if (extractor.supports(artifact.getFilename())) {
                return extractor.extract(artifact);
            }
        }
        throw new MalformedPackageException("Unsupported package file type: " + artifact.getFilename());
    }
}

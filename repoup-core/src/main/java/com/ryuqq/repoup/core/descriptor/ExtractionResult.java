package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.model.PackageDescriptor;

import java.util.List;

/**
 * Descriptor extracted from an artifact, together with any non-fatal mismatches.
 *
 * @param descriptor extracted descriptor
 * @param mismatches header/file name disagreements (may be empty)
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record ExtractionResult(
    PackageDescriptor descriptor,
    List<DescriptorMismatch> mismatches
) {

    public ExtractionResult {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
    }

    public static ExtractionResult of(PackageDescriptor descriptor) {
        return new ExtractionResult(descriptor, List.of());
    }

    public boolean hasMismatches() {
        return !mismatches.isEmpty();
    }
}

package com.ryuqq.repoup.core.descriptor;

/**
 * Disagreement between header metadata and the metadata encoded in the file name.
 *
 * <p>Non-fatal: header values are authoritative for routing, the mismatch is only
 * surfaced as a warning in the update report.</p>
 *
 * @param field descriptor field name (e.g. "version")
 * @param headerValue value read from the package header
 * @param filenameValue value parsed from the file name
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record DescriptorMismatch(
    String field,
    String headerValue,
    String filenameValue
) {

    public DescriptorMismatch {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
    }

    /**
     * Human readable warning text used in reports.
     *
     * @return warning message
     */
    public String describe() {
        return String.format("%s differs: header=%s, filename=%s (header value used)", field, headerValue, filenameValue);
    }
}

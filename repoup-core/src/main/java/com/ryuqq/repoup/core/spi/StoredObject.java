package com.ryuqq.repoup.core.spi;

/**
 * Object read from storage together with its current version token.
 *
 * @param key storage key
 * @param content object bytes
 * @param version version token observed at read time
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record StoredObject(
    String key,
    byte[] content,
    VersionToken version
) {

    public StoredObject {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
    }
}

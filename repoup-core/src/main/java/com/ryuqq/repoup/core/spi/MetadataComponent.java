package com.ryuqq.repoup.core.spi;

/**
 * One index component produced for a repository (e.g. RPM "primary" XML).
 *
 * <p>The engine stores each component under a content-addressed key
 * {@code <prefix>/metadata/<name>-<digest>.<extension>}, so components never overwrite
 * objects referenced by a published manifest.</p>
 *
 * @param name component name (letters, digits, '_' and '.'; e.g. "primary", "filelists_db")
 * @param extension file extension without leading dot (e.g. "xml.gz")
 * @param content component bytes
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record MetadataComponent(
    String name,
    String extension,
    byte[] content
) {

    public MetadataComponent {
        if (name == null || !name.matches("^[A-Za-z0-9_.]+$")) {
            throw new IllegalArgumentException("name must match [A-Za-z0-9_.]+ (current: " + name + ")");
        }
        if (extension == null || !extension.matches("^[A-Za-z0-9.]+$")) {
            throw new IllegalArgumentException("extension must match [A-Za-z0-9.]+ (current: " + extension + ")");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}

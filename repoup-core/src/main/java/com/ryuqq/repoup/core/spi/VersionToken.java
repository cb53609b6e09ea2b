package com.ryuqq.repoup.core.spi;

/**
 * Opaque version identifier of a stored object (ETag, generation number, ...).
 *
 * <p>Every successful write produces a new token. A token is only meaningful for
 * the key it was returned for.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class VersionToken {

    private final String value;

    private VersionToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("VersionToken cannot be null or blank");
        }
        this.value = value;
    }

    public static VersionToken of(String value) {
        return new VersionToken(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionToken that = (VersionToken) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "VersionToken{" + value + '}';
    }
}

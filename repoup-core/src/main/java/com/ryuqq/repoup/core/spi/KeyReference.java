package com.ryuqq.repoup.core.spi;

/**
 * Reference to the signing key material handed to the {@link SigningTool}.
 *
 * <p>The passphrase is never included in {@link #toString()}.</p>
 *
 * @param keyLocation path or identifier of the private key (e.g. an armored key file)
 * @param passphrase key passphrase (nullable)
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record KeyReference(
    String keyLocation,
    String passphrase
) {

    public KeyReference {
        if (keyLocation == null || keyLocation.isBlank()) {
            throw new IllegalArgumentException("keyLocation cannot be null or blank");
        }
    }

    public static KeyReference of(String keyLocation) {
        return new KeyReference(keyLocation, null);
    }

    public boolean hasPassphrase() {
        return passphrase != null;
    }

    @Override
    public String toString() {
        return "KeyReference{" + keyLocation + (passphrase == null ? "" : ", passphrase=***") + '}';
    }
}

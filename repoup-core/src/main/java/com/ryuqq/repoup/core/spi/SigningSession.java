package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.error.SigningFailedException;

/**
 * Key material imported into the signing tool for the duration of one scoped use.
 *
 * <p>{@link #close()} must remove every trace of the imported key from the keyring
 * (and from the system keyring when verification imported it there).</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public interface SigningSession extends AutoCloseable {

    /**
     * Signs a package, returning the package bytes with the embedded signature.
     *
     * @param filename package file name
     * @param content unsigned package bytes
     * @return signed package bytes
     * @throws SigningFailedException if the tool fails
     */
    byte[] signPackage(String filename, byte[] content);

    /**
     * Produces an armored detached signature.
     *
     * @param content bytes to sign
     * @return armored signature bytes
     * @throws SigningFailedException if the tool fails
     */
    byte[] signDetached(byte[] content);

    /**
     * Verifies an embedded package signature.
     *
     * @param filename package file name
     * @param content signed package bytes
     * @return true if the signature is valid
     * @throws SigningFailedException if the tool itself fails
     */
    boolean verifyPackage(String filename, byte[] content);

    /**
     * Verifies a detached signature.
     *
     * @param content signed bytes
     * @param signature armored signature
     * @return true if the signature is valid
     * @throws SigningFailedException if the tool itself fails
     */
    boolean verifyDetached(byte[] content, byte[] signature);

    /**
     * Removes the imported key. Never throws; cleanup failures are logged by the implementation.
     */
    @Override
    void close();
}

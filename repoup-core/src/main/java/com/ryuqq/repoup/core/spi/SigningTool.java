package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.error.SigningFailedException;

/**
 * External signing capability (gpg, rpmsign, ...).
 *
 * <p>Key state is imported per session and released when the session closes. Sessions touch
 * process-wide keyring state, so the engine opens at most one session at a time per process.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SigningTool {

    /**
     * Imports the key and opens a signing session.
     *
     * @param key key reference
     * @return open session; the caller must close it
     * @throws SigningFailedException if the key cannot be imported
     */
    SigningSession openSession(KeyReference key);
}

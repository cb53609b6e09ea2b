package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.core.error.SigningFailedException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.spi.KeyReference;
import com.ryuqq.repoup.core.spi.SigningSession;
import com.ryuqq.repoup.core.spi.SigningTool;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic stand-in for gpg / rpm signing.
 *
 * <p>Package signatures are appended as a trailer, detached signatures are
 * {@code FAKE-SIG(<sha256>)}. Open and closed sessions are counted so tests can assert that
 * key material is always released.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class FakeSigningTool implements SigningTool {

    private static final String TRAILER = "\n#signed";

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private volatile boolean failManifestSigning;
    private volatile boolean rejectVerification;

    @Override
    public SigningSession openSession(KeyReference key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        opened.incrementAndGet();
        return new FakeSession();
    }

    /**
     * Makes every detached (manifest) signature fail with {@link SigningFailedException}.
     */
    public void failManifestSigning(boolean fail) {
        this.failManifestSigning = fail;
    }

    /**
     * Makes every verification return false.
     */
    public void rejectVerification(boolean reject) {
        this.rejectVerification = reject;
    }

    public int openedSessions() {
        return opened.get();
    }

    public int closedSessions() {
        return closed.get();
    }

    /**
     * Expected detached signature of the given bytes.
     *
     * @param content signed bytes
     * @return signature bytes
     */
    public static byte[] signatureOf(byte[] content) {
        return ("FAKE-SIG(" + ContentHash.sha256(content).getValue() + ")").getBytes(StandardCharsets.UTF_8);
    }

    public static boolean isSignedPackage(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        return text.endsWith(TRAILER);
    }

    private final class FakeSession implements SigningSession {

        @Override
        public byte[] signPackage(String filename, byte[] content) {
            byte[] trailer = TRAILER.getBytes(StandardCharsets.UTF_8);
            byte[] signed = Arrays.copyOf(content, content.length + trailer.length);
            System.arraycopy(trailer, 0, signed, content.length, trailer.length);
            return signed;
        }

        @Override
        public byte[] signDetached(byte[] content) {
            if (failManifestSigning) {
                throw new SigningFailedException("gpg: signing failed: Inappropriate ioctl for device");
            }
            return signatureOf(content);
        }

        @Override
        public boolean verifyPackage(String filename, byte[] content) {
            return !rejectVerification && isSignedPackage(content);
        }

        @Override
        public boolean verifyDetached(byte[] content, byte[] signature) {
            return !rejectVerification && Arrays.equals(signatureOf(content), signature);
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }
    }
}

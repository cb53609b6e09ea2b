package com.ryuqq.repoup.adapter.runner.signing;

import com.ryuqq.repoup.core.spi.KeyReference;
import com.ryuqq.repoup.core.spi.SigningSession;
import com.ryuqq.repoup.core.spi.SigningTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 키링 임계 구역.
 *
 * <p>서명 도구의 키링은 프로세스 전역 상태이므로, 키 import → 사용 → 제거를 하나의
 * 직렬화된 구역으로 묶습니다. 서로 다른 저장소를 병렬로 처리하더라도 키링을
 * 동시에 만지는 스레드는 하나뿐입니다.</p>
 *
 * <pre>{@code
 * try (KeyringGuard.Scope scope = guard.open(tool, key)) {
 *     byte[] signature = scope.session().signDetached(manifest);
 * }   // 세션 close (키 제거) 후 잠금 해제
 * }</pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class KeyringGuard {

    private static final Logger log = LoggerFactory.getLogger(KeyringGuard.class);

    private static final KeyringGuard PROCESS_WIDE = new KeyringGuard();

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * 테스트용 독립 guard. 운영 코드는 {@link #processWide()}를 사용합니다.
     */
    public KeyringGuard() {
    }

    public static KeyringGuard processWide() {
        return PROCESS_WIDE;
    }

    /**
     * 임계 구역에 진입해 서명 세션을 엽니다.
     *
     * <p>세션 열기가 실패하면 잠금은 즉시 해제됩니다.</p>
     *
     * @param tool 서명 도구
     * @param key 키 참조
     * @return 닫으면 세션을 정리하고 잠금을 해제하는 scope
     */
    public Scope open(SigningTool tool, KeyReference key) {
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        lock.lock();
        try {
            SigningSession session = tool.openSession(key);
            if (session == null) {
                throw new IllegalStateException("SigningTool returned a null session");
            }
            log.debug("Keyring scope opened for {}", key);
            return new Scope(session);
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * 열린 키링 구역.
     */
    public final class Scope implements AutoCloseable {

        private final SigningSession session;
        private boolean closed;

        private Scope(SigningSession session) {
            this.session = session;
        }

        public SigningSession session() {
            if (closed) {
                throw new IllegalStateException("Keyring scope already closed");
            }
            return session;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                session.close();
            } finally {
                lock.unlock();
                log.debug("Keyring scope closed");
            }
        }
    }
}

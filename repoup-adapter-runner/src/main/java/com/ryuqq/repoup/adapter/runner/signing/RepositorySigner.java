package com.ryuqq.repoup.adapter.runner.signing;

import com.ryuqq.repoup.core.error.SigningFailedException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.error.VerificationFailedException;
import com.ryuqq.repoup.core.spi.SigningSession;
import com.ryuqq.repoup.core.spi.SigningTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 패키지 및 매니페스트 서명기.
 *
 * <p>호출마다 {@link KeyringGuard} 구역 안에서 키를 import하고, 끝나면 반드시 제거합니다.
 * 도구 오류는 {@link SigningFailedException}, 검증 실패는 {@link VerificationFailedException}으로
 * 보고됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class RepositorySigner {

    private static final Logger log = LoggerFactory.getLogger(RepositorySigner.class);

    private final SigningTool tool;
    private final SignerConfig config;
    private final KeyringGuard guard;

    public RepositorySigner(SigningTool tool, SignerConfig config) {
        this(tool, config, KeyringGuard.processWide());
    }

    /**
     * 생성자.
     *
     * @param tool 서명 도구 (서명 비활성화면 null 허용)
     * @param config 서명 설정
     * @param guard 키링 guard
     * @throws IllegalArgumentException 서명이 활성화됐는데 tool이 null인 경우
     */
    public RepositorySigner(SigningTool tool, SignerConfig config, KeyringGuard guard) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (config.isEnabled() && tool == null) {
            throw new IllegalArgumentException("tool cannot be null when signing is enabled");
        }
        this.tool = tool;
        this.config = config;
        this.guard = guard;
    }

    public static RepositorySigner disabled() {
        return new RepositorySigner(null, SignerConfig.disabled());
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * 패키지 서명 (하나의 키링 구역에서 일괄 처리).
     *
     * @param artifacts 서명할 패키지
     * @return 서명된 바이트 (입력 순서), 서명 비활성화면 입력 그대로
     * @throws SigningFailedException 도구 오류
     * @throws VerificationFailedException 검증 실패
     */
    public List<byte[]> signPackages(List<Artifact> artifacts) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        List<byte[]> signed = new ArrayList<>(artifacts.size());
        if (!isEnabled() || artifacts.isEmpty()) {
            for (Artifact artifact : artifacts) {
                signed.add(artifact.content());
            }
            return signed;
        }
        try (KeyringGuard.Scope scope = guard.open(tool, config.keyReference())) {
            SigningSession session = scope.session();
            for (Artifact artifact : artifacts) {
                byte[] result = call("sign package " + artifact.filename(),
                    () -> session.signPackage(artifact.filename(), artifact.content()));
                if (config.verify()) {
                    boolean valid = call("verify package " + artifact.filename(),
                        () -> session.verifyPackage(artifact.filename(), result));
                    if (!valid) {
                        throw new VerificationFailedException("Signature verification failed for " + artifact.filename());
                    }
                }
                signed.add(result);
            }
        } catch (SigningFailedException | VerificationFailedException | UpdateTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("Unable to open signing session: " + e.getMessage(), e);
        }
        log.debug("Signed {} packages", signed.size());
        return signed;
    }

    /**
     * 매니페스트 detached 서명.
     *
     * @param manifestBytes 게시할 매니페스트 바이트
     * @return armored 서명
     * @throws IllegalStateException 서명이 비활성화된 경우
     * @throws SigningFailedException 도구 오류
     * @throws VerificationFailedException 검증 실패
     */
    public byte[] signManifest(byte[] manifestBytes) {
        if (manifestBytes == null) {
            throw new IllegalArgumentException("manifestBytes cannot be null");
        }
        if (!isEnabled()) {
            throw new IllegalStateException("Signing is disabled");
        }
        try (KeyringGuard.Scope scope = guard.open(tool, config.keyReference())) {
            SigningSession session = scope.session();
            byte[] signature = call("sign manifest", () -> session.signDetached(manifestBytes));
            if (config.verify()) {
                boolean valid = call("verify manifest", () -> session.verifyDetached(manifestBytes, signature));
                if (!valid) {
                    throw new VerificationFailedException("Manifest signature verification failed");
                }
            }
            return signature;
        } catch (SigningFailedException | VerificationFailedException | UpdateTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("Unable to open signing session: " + e.getMessage(), e);
        }
    }

    private static <T> T call(String operation, SigningCall<T> action) {
        try {
            T result = action.call();
            if (result == null) {
                throw new SigningFailedException("Signing tool returned nothing for: " + operation);
            }
            return result;
        } catch (SigningFailedException | VerificationFailedException | UpdateTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    public SignerConfig getConfig() {
        return config;
    }

    @FunctionalInterface
    private interface SigningCall<T> {
        T call();
    }

    /**
     * 서명 대상 패키지.
     *
     * @param filename 패키지 파일 이름
     * @param content 서명 전 바이트
     */
    public record Artifact(String filename, byte[] content) {

        public Artifact {
            if (filename == null || filename.isBlank()) {
                throw new IllegalArgumentException("filename cannot be null or blank");
            }
            if (content == null) {
                throw new IllegalArgumentException("content cannot be null");
            }
        }
    }
}

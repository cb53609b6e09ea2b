package com.ryuqq.repoup.adapter.runner.signing;

import com.ryuqq.repoup.core.spi.KeyReference;

/**
 * 서명 설정.
 *
 * <p>{@code keyReference}가 null이면 서명 비활성화 (패키지는 받은 그대로 저장되고
 * 매니페스트 서명 오브젝트도 만들지 않음).</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param keyReference 서명 키 참조 (null이면 비활성화)
 * @param verify 서명 직후 검증 여부
 */
public record SignerConfig(
    KeyReference keyReference,
    boolean verify
) {

    /**
     * 기본 설정 (서명 비활성화).
     */
    public SignerConfig() {
        this(null, false);
    }

    public SignerConfig {
        if (verify && keyReference == null) {
            throw new IllegalArgumentException("verify requires a keyReference");
        }
    }

    public static SignerConfig disabled() {
        return new SignerConfig();
    }

    public static SignerConfig signingWith(KeyReference keyReference) {
        if (keyReference == null) {
            throw new IllegalArgumentException("keyReference cannot be null");
        }
        return new SignerConfig(keyReference, false);
    }

    public boolean isEnabled() {
        return keyReference != null;
    }

    public SignerConfig withVerify(boolean verify) {
        return new SignerConfig(keyReference, verify);
    }
}

package com.ryuqq.repoup.adapter.runner.metadata;

/**
 * 게시 대기 중인 인덱스 컴포넌트 (키와 내용).
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param role 컴포넌트 role
 * @param key 내용 주소 기반 스토리지 키
 * @param digest 내용의 SHA-256
 * @param content 바이트
 */
public record StagedComponent(
    String role,
    String key,
    String digest,
    byte[] content
) {

    public StagedComponent {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("digest cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public ManifestComponent toManifestComponent() {
        return new ManifestComponent(role, key, digest, content.length);
    }
}

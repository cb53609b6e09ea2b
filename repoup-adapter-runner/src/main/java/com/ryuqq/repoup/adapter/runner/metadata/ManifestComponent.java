package com.ryuqq.repoup.adapter.runner.metadata;

/**
 * 매니페스트가 참조하는 인덱스 컴포넌트.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param role 컴포넌트 역할 (생성기 컴포넌트 이름 또는 "packages")
 * @param key 스토리지 키 ({@code <prefix>/metadata/<role>-<digest>.<ext>})
 * @param digest 내용의 SHA-256
 * @param size 바이트 크기
 */
public record ManifestComponent(
    String role,
    String key,
    String digest,
    long size
) {

    public ManifestComponent {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("digest cannot be null or blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative (current: " + size + ")");
        }
    }
}

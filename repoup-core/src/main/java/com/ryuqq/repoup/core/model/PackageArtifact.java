package com.ryuqq.repoup.core.model;

import java.util.Arrays;

/**
 * 업데이트 대상 패키지 아티팩트 (파일 이름 + 바이트).
 *
 * <p>바이트 배열은 방어적으로 복사되며, 콘텐츠 해시는 최초 조회 시 한 번만 계산됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class PackageArtifact {

    private final String filename;
    private final byte[] content;
    private volatile ContentHash contentHash;

    private PackageArtifact(String filename, byte[] content) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        this.filename = basename(filename);
        this.content = content.clone();
    }

    /**
     * PackageArtifact 생성.
     *
     * @param filename 파일 이름 (경로가 포함되면 마지막 요소만 사용)
     * @param content 아티팩트 바이트
     * @return PackageArtifact 인스턴스
     * @throws IllegalArgumentException filename 또는 content가 유효하지 않은 경우
     */
    public static PackageArtifact of(String filename, byte[] content) {
        return new PackageArtifact(filename, content);
    }

    private static String basename(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public String getFilename() {
        return filename;
    }

    /**
     * 아티팩트 바이트 조회 (복사본).
     *
     * @return 바이트 복사본
     */
    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    /**
     * 콘텐츠 해시 조회 (지연 계산).
     *
     * @return SHA-256 ContentHash
     */
    public ContentHash contentHash() {
        ContentHash hash = contentHash;
        if (hash == null) {
            hash = ContentHash.sha256(content);
            contentHash = hash;
        }
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageArtifact that = (PackageArtifact) o;
        return filename.equals(that.filename) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * filename.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "PackageArtifact{" + filename + ", " + content.length + " bytes}";
    }
}

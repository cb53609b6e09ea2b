package com.ryuqq.repoup.core.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 패키지 아티팩트 바이트의 SHA-256 다이제스트.
 *
 * <p>ContentHash는 저장소 내 패키지의 식별자이며 멱등성 판단에 사용됩니다.
 * 동일한 바이트를 다시 추가하면 같은 ContentHash가 계산되어 no-op으로 처리됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>64자리 16진수 (대소문자 무관, 내부적으로 소문자 정규화)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class ContentHash {

    private static final String ALGORITHM = "SHA-256";

    private final String value;

    private ContentHash(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ContentHash cannot be null or blank");
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (!normalized.matches("^[0-9a-f]{64}$")) {
            throw new IllegalArgumentException("ContentHash must be a 64 character hex SHA-256 digest: " + value);
        }
        this.value = normalized;
    }

    /**
     * 16진수 문자열로부터 ContentHash 생성.
     *
     * @param value SHA-256 16진수 문자열
     * @return ContentHash 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ContentHash of(String value) {
        return new ContentHash(value);
    }

    /**
     * 바이트 배열의 SHA-256 다이제스트 계산.
     *
     * @param content 다이제스트를 계산할 바이트
     * @return ContentHash 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static ContentHash sha256(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return new ContentHash(HexFormat.of().formatHex(digest(content)));
    }

    private static byte[] digest(byte[] content) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(content);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK는 SHA-256을 제공해야 함
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    /**
     * ContentHash 값 조회.
     *
     * @return 소문자 16진수 문자열
     */
    public String getValue() {
        return value;
    }

    /**
     * 로그 출력용 축약 값 (앞 12자리).
     *
     * @return 축약된 다이제스트
     */
    public String shortValue() {
        return value.substring(0, 12);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentHash that = (ContentHash) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ContentHash{" + value + '}';
    }
}

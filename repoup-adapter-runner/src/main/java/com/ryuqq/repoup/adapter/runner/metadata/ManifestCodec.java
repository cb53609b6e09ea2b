package com.ryuqq.repoup.adapter.runner.metadata;

import com.ryuqq.repoup.adapter.runner.json.RepoupJson;
import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.RepositoryPrefix;

import java.io.IOException;

/**
 * Manifest JSON encoding.
 *
 * <pre>
 * {"components":[{"digest":"..","key":"arm/metadata/packages-...json","role":"packages","size":123}],
 *  "format":"rpm","metadataVersion":3,"publishedAt":"2024-05-01T10:00:00Z"}
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class ManifestCodec {

    private ManifestCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static byte[] encode(RepositoryManifest manifest) {
        try {
            return RepoupJson.mapper().writeValueAsBytes(manifest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode manifest", e);
        }
    }

    /**
     * 매니페스트 디코딩.
     *
     * @param content 매니페스트 바이트
     * @return RepositoryManifest
     * @throws MetadataBuildFailedException 매니페스트를 해석할 수 없는 경우
     */
    public static RepositoryManifest decode(byte[] content) {
        try {
            return RepoupJson.mapper().readValue(content, RepositoryManifest.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new MetadataBuildFailedException("Unreadable repository manifest: " + e.getMessage(), e);
        }
    }

    /**
     * 매니페스트 바이트에 대한 detached 서명 오브젝트 키.
     *
     * @param prefix 저장소 prefix
     * @param manifestBytes 게시될 매니페스트 바이트
     * @return {@code <prefix>/metadata/manifest-<sha256>.asc}
     */
    public static String signatureKey(RepositoryPrefix prefix, byte[] manifestBytes) {
        return prefix.metadataKey(RepositoryPrefix.MANIFEST_NAME + "-" + ContentHash.sha256(manifestBytes).getValue() + ".asc");
    }
}

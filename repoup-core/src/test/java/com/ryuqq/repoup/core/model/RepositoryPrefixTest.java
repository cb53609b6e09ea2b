package com.ryuqq.repoup.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RepositoryPrefix 테스트 - 키 레이아웃 및 동등성.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class RepositoryPrefixTest {

    @Test
    void keys_FollowStorageLayout() {
        RepositoryPrefix prefix = RepositoryPrefix.of("/arm/");

        assertEquals("/arm", prefix.getValue());
        assertEquals("arm/metadata/manifest", prefix.manifestKey());
        assertEquals("arm/lock", prefix.lockKey());
        assertEquals("arm/metadata/primary-abc.xml", prefix.metadataKey("primary-abc.xml"));
        assertEquals("arm/", prefix.rootKey());
    }

    @Test
    void packageKey_UsesContentHashAndExtension() {
        ContentHash hash = ContentHash.sha256(new byte[] {1});
        PackageDescriptor descriptor = new PackageDescriptor("foo", "1.0", "1", "x86_64", null, PackageFormat.RPM, hash);

        assertEquals("rpm/el8/packages/" + hash.getValue() + ".rpm",
            RepositoryPrefix.of("rpm/el8").packageKey(descriptor));
    }

    @Test
    void rootPrefix_HasNoKeyBase() {
        RepositoryPrefix root = RepositoryPrefix.of("/");

        assertEquals("metadata/manifest", root.manifestKey());
        assertEquals("", root.rootKey());
    }

    @Test
    void equals_LeadingSlashIgnored() {
        assertEquals(RepositoryPrefix.of("/arm"), RepositoryPrefix.of("arm"));
        assertEquals(RepositoryPrefix.of("/arm").hashCode(), RepositoryPrefix.of("arm/").hashCode());
        assertTrue(RepositoryPrefix.of("/a").compareTo(RepositoryPrefix.of("b")) < 0);
    }

    @Test
    void fromManifestKey_RestoresPrefix() {
        assertEquals(RepositoryPrefix.of("arm"), RepositoryPrefix.fromManifestKey("arm/metadata/manifest"));
        assertEquals(RepositoryPrefix.of("/"), RepositoryPrefix.fromManifestKey("metadata/manifest"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryPrefix.fromManifestKey("arm/lock"));
    }

    @Test
    void of_InvalidSegments_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RepositoryPrefix.of(" "));
        assertThrows(IllegalArgumentException.class, () -> RepositoryPrefix.of("a//b"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryPrefix.of("a/../b"));
    }
}

package com.ryuqq.repoup.adapter.inmemory.storage;

import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.StorageException;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.spi.StoredObject;
import com.ryuqq.repoup.core.spi.VersionToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryObjectStorage}.
 *
 * <p>Covers get/put/list/delete, conditional put semantics, failure injection and
 * the per-key atomicity of conditional puts under concurrency.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class InMemoryObjectStorageTest {

    private InMemoryObjectStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testPutThenGet_ReturnsContentAndVersion() {
        // When
        VersionToken version = storage.put("repo/a", bytes("hello"));
        StoredObject stored = storage.get("repo/a");

        // Then
        assertThat(stored.content()).isEqualTo(bytes("hello"));
        assertThat(stored.version()).isEqualTo(version);
    }

    @Test
    void testGet_WhenMissing_ThrowsObjectNotFound() {
        assertThatThrownBy(() -> storage.get("repo/missing"))
            .isInstanceOf(ObjectNotFoundException.class)
            .hasMessageContaining("repo/missing");
        assertThat(storage.exists("repo/missing")).isFalse();
    }

    @Test
    void testPut_EveryWriteGetsNewVersion() {
        VersionToken v1 = storage.put("k", bytes("1"));
        VersionToken v2 = storage.put("k", bytes("1"));

        assertThat(v1).isNotEqualTo(v2);
    }

    @Test
    void testPutIfAbsent_WhenExists_FailsAndKeepsOriginal() {
        // Given
        storage.put("repo/lock", bytes("first"), Precondition.ifAbsent());

        // When & Then
        assertThatThrownBy(() -> storage.put("repo/lock", bytes("second"), Precondition.ifAbsent()))
            .isInstanceOf(PreconditionFailedException.class)
            .extracting(e -> ((PreconditionFailedException) e).getKey())
            .isEqualTo("repo/lock");
        assertThat(storage.get("repo/lock").content()).isEqualTo(bytes("first"));
    }

    @Test
    void testPutIfMatch_OnlyWithCurrentToken() {
        // Given
        VersionToken v1 = storage.put("m", bytes("one"));
        VersionToken v2 = storage.put("m", bytes("two"), Precondition.ifMatch(v1));

        // When & Then: stale token rejected
        assertThatThrownBy(() -> storage.put("m", bytes("three"), Precondition.ifMatch(v1)))
            .isInstanceOf(PreconditionFailedException.class);
        assertThat(storage.get("m").version()).isEqualTo(v2);
    }

    @Test
    void testPutIfMatch_WhenMissing_Fails() {
        assertThatThrownBy(() -> storage.put("m", bytes("x"), Precondition.ifMatch(VersionToken.of("v1"))))
            .isInstanceOf(PreconditionFailedException.class);
        assertThat(storage.size()).isZero();
    }

    @Test
    void testList_ReturnsSortedKeysUnderPrefix() {
        storage.put("b/metadata/manifest", bytes("x"));
        storage.put("a/metadata/manifest", bytes("x"));
        storage.put("a/lock", bytes("x"));

        assertThat(storage.list("a/")).containsExactly("a/lock", "a/metadata/manifest");
        assertThat(storage.list("")).hasSize(3);
    }

    @Test
    void testDelete_IsIdempotent() {
        storage.put("k", bytes("x"));

        storage.delete("k");
        storage.delete("k");

        assertThat(storage.exists("k")).isFalse();
        assertThat(storage.deleteCount()).isEqualTo(1);
    }

    @Test
    void testFailureInjection_OnlyMatchingKeysFail() {
        // Given
        storage.failPutsMatching(key -> key.endsWith("manifest"));

        // When & Then
        assertThatThrownBy(() -> storage.put("r/metadata/manifest", bytes("x")))
            .isInstanceOf(StorageException.class);
        storage.put("r/metadata/primary-1.xml", bytes("x"));
        assertThat(storage.writtenKeys()).containsExactly("r/metadata/primary-1.xml");

        storage.clearFailures();
        storage.put("r/metadata/manifest", bytes("x"));
        assertThat(storage.putCount()).isEqualTo(2);
    }

    @Test
    void testGetReturnsCopy_MutationDoesNotLeak() {
        storage.put("k", bytes("abc"));

        storage.get("k").content()[0] = 'z';

        assertThat(storage.get("k").content()).isEqualTo(bytes("abc"));
    }

    @Test
    void testConcurrentPutIfAbsent_ExactlyOneWins() throws Exception {
        // Given
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            String holder = "holder-" + i;
            results.add(pool.submit(() -> {
                start.await();
                try {
                    storage.put("repo/lock", bytes(holder), Precondition.ifAbsent());
                    return true;
                } catch (PreconditionFailedException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        // Then
        assertThat(winners).isEqualTo(1);
        assertThat(storage.putCount()).isEqualTo(1);
    }
}

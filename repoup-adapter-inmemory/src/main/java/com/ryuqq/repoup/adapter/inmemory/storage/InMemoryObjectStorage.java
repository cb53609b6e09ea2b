package com.ryuqq.repoup.adapter.inmemory.storage;

import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.StorageException;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.spi.StoredObject;
import com.ryuqq.repoup.core.spi.VersionToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link ObjectStorage} for testing and reference purposes.
 *
 * <p>Every successful put assigns a fresh {@link VersionToken}. Conditional puts are evaluated
 * atomically per key with {@link ConcurrentHashMap#compute}, which gives the same per-object
 * compare-and-put guarantee a real object store offers and nothing more: there are no
 * multi-key transactions.</p>
 *
 * <p><strong>Test Support:</strong></p>
 * <ul>
 *   <li>Failure injection for get / put / delete by key predicate ({@link StorageException})</li>
 *   <li>A put listener invoked before each put (used to interleave concurrent writers)</li>
 *   <li>A write log of successfully written keys, in order</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Strongly consistent (no replica lag)</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryObjectStorage storage = new InMemoryObjectStorage();
 * VersionToken v1 = storage.put("repo/lock", lease, Precondition.ifAbsent());
 *
 * // fails with PreconditionFailedException: object exists
 * storage.put("repo/lock", other, Precondition.ifAbsent());
 *
 * // make every manifest write fail
 * storage.failPutsMatching(key -&gt; key.endsWith("metadata/manifest"));
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class InMemoryObjectStorage implements ObjectStorage {

    private final ConcurrentHashMap<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final AtomicLong versionSequence = new AtomicLong();
    private final List<String> writeLog = new CopyOnWriteArrayList<>();
    private final AtomicLong deleteCount = new AtomicLong();

    private volatile Predicate<String> failGets = key -> false;
    private volatile Predicate<String> failPuts = key -> false;
    private volatile Predicate<String> failDeletes = key -> false;
    private volatile Consumer<String> putListener = key -> { };

    /**
     * {@inheritDoc}
     *
     * <p>Returns a defensive copy of the stored content.</p>
     */
    @Override
    public StoredObject get(String key) {
        requireKey(key);
        if (failGets.test(key)) {
            throw new StorageException("Injected get failure: " + key);
        }
        StoredObject stored = objects.get(key);
        if (stored == null) {
            throw new ObjectNotFoundException(key);
        }
        return new StoredObject(key, stored.content().clone(), stored.version());
    }

    @Override
    public VersionToken put(String key, byte[] content, Precondition precondition) {
        requireKey(key);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (precondition == null) {
            throw new IllegalArgumentException("precondition cannot be null");
        }
        putListener.accept(key);
        if (failPuts.test(key)) {
            throw new StorageException("Injected put failure: " + key);
        }

        byte[] copy = content.clone();
        StoredObject written = objects.compute(key, (k, current) -> {
            VersionToken currentVersion = current == null ? null : current.version();
            if (!precondition.isSatisfiedBy(currentVersion)) {
                // compute()는 예외 발생 시 매핑을 변경하지 않음
                throw new PreconditionFailedException(key,
                    "Precondition " + precondition.getClass().getSimpleName() + " not satisfied for " + key + " (current: " + currentVersion + ")");
            }
            return new StoredObject(k, copy, VersionToken.of("v" + versionSequence.incrementAndGet()));
        });
        writeLog.add(key);
        return written.version();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Idempotent: deleting a missing key is a no-op.</p>
     */
    @Override
    public void delete(String key) {
        requireKey(key);
        if (failDeletes.test(key)) {
            throw new StorageException("Injected delete failure: " + key);
        }
        if (objects.remove(key) != null) {
            deleteCount.incrementAndGet();
        }
    }

    @Override
    public List<String> list(String prefix) {
        String normalized = prefix == null ? "" : prefix;
        List<String> keys = new ArrayList<>();
        for (String key : objects.keySet()) {
            if (key.startsWith(normalized)) {
                keys.add(key);
            }
        }
        Collections.sort(keys);
        return keys;
    }

    // ========== Test support ==========

    /**
     * Makes every get of a matching key fail with {@link StorageException}.
     *
     * @param keyPredicate keys to fail
     */
    public void failGetsMatching(Predicate<String> keyPredicate) {
        this.failGets = requirePredicate(keyPredicate);
    }

    /**
     * Makes every put of a matching key fail with {@link StorageException}.
     *
     * @param keyPredicate keys to fail
     */
    public void failPutsMatching(Predicate<String> keyPredicate) {
        this.failPuts = requirePredicate(keyPredicate);
    }

    /**
     * Makes every delete of a matching key fail with {@link StorageException}.
     *
     * @param keyPredicate keys to fail
     */
    public void failDeletesMatching(Predicate<String> keyPredicate) {
        this.failDeletes = requirePredicate(keyPredicate);
    }

    /**
     * Removes all injected failures.
     */
    public void clearFailures() {
        this.failGets = key -> false;
        this.failPuts = key -> false;
        this.failDeletes = key -> false;
    }

    /**
     * Registers a callback invoked with the key before each put attempt.
     *
     * @param listener put listener (null resets to no-op)
     */
    public void onPut(Consumer<String> listener) {
        this.putListener = listener == null ? key -> { } : listener;
    }

    /**
     * Keys successfully written so far, in write order (duplicates kept).
     *
     * @return write log copy
     */
    public List<String> writtenKeys() {
        return List.copyOf(writeLog);
    }

    public int putCount() {
        return writeLog.size();
    }

    public long deleteCount() {
        return deleteCount.get();
    }

    public void resetCounters() {
        writeLog.clear();
        deleteCount.set(0);
    }

    /**
     * Snapshot of all keys and their current version tokens.
     *
     * @return key → version token
     */
    public Map<String, VersionToken> versions() {
        Map<String, VersionToken> versions = new TreeMap<>();
        objects.forEach((key, stored) -> versions.put(key, stored.version()));
        return versions;
    }

    public int size() {
        return objects.size();
    }

    /**
     * Clears all objects, counters and injected failures.
     */
    public void clear() {
        objects.clear();
        resetCounters();
        clearFailures();
        onPut(null);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static Predicate<String> requirePredicate(Predicate<String> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("keyPredicate cannot be null");
        }
        return predicate;
    }
}

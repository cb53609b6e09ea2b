package com.ryuqq.repoup.core.spi;

import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.StorageException;

import java.util.List;

/**
 * Object storage capability SPI.
 *
 * <p>Thin capability surface over an object store (S3, GCS, ...) that offers no transactions
 * and no multi-key atomicity. The only concurrency primitive the engine relies on is the
 * per-object conditional put.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Read objects together with their current version token</li>
 *   <li>Conditional writes ({@link Precondition#ifAbsent()}, {@link Precondition#ifMatch(VersionToken)})</li>
 *   <li>Deletes (idempotent: deleting a missing key succeeds)</li>
 *   <li>Prefix listing</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Conditional put must be atomic per key: of two concurrent writers with the same
 *       precondition, at most one succeeds</li>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Transient I/O errors are reported as {@link StorageException}</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public interface ObjectStorage {

    /**
     * Reads an object.
     *
     * @param key storage key
     * @return the object with its version token
     * @throws ObjectNotFoundException if no object exists for the key
     * @throws StorageException on transient I/O errors
     */
    StoredObject get(String key);

    /**
     * Writes an object if the precondition holds.
     *
     * @param key storage key
     * @param content object bytes
     * @param precondition write precondition
     * @return version token of the written object
     * @throws PreconditionFailedException if the precondition does not hold
     * @throws StorageException on transient I/O errors
     */
    VersionToken put(String key, byte[] content, Precondition precondition);

    /**
     * Writes an object unconditionally.
     *
     * @param key storage key
     * @param content object bytes
     * @return version token of the written object
     * @throws StorageException on transient I/O errors
     */
    default VersionToken put(String key, byte[] content) {
        return put(key, content, Precondition.none());
    }

    /**
     * Deletes an object. Must succeed when the object does not exist.
     *
     * @param key storage key
     * @throws StorageException on transient I/O errors
     */
    void delete(String key);

    /**
     * Lists keys starting with the given prefix, in lexicographic order.
     *
     * @param prefix key prefix (empty string lists everything)
     * @return matching keys (may be empty)
     * @throws StorageException on transient I/O errors
     */
    List<String> list(String prefix);

    /**
     * Checks whether an object exists.
     *
     * @param key storage key
     * @return true if the object exists
     * @throws StorageException on transient I/O errors
     */
    default boolean exists(String key) {
        try {
            get(key);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }
}

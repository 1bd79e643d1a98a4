/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.objectstore.storage;

import java.io.Closeable;
import java.util.Optional;

/**
 * Storage capability contract consumed by the request-handling layer.
 * <p>
 * Objects are opaque byte blobs addressed by a {@code (bucketId, objectId)} pair.
 * Both identifiers must match {@code [a-z0-9_-]+}; implementations reject
 * anything else with {@link IllegalArgumentException} before touching state.
 * <p>
 * Absence of a bucket or object is a normal result, never an error.
 * I/O failures are reported as {@link StorageException} and leave the stored
 * data unchanged.
 * <p>
 * Implementations are safe for use by any number of caller threads.
 *
 * @see MemoryObjectStore
 * @see dev.mars.objectstore.storage.file.FileObjectStore
 */
public interface ObjectStore extends Closeable {

    /**
     * Creates or replaces an object. The bucket is created on first use.
     *
     * @param payload  the object content ({@code null} is stored as empty)
     * @param objectId the object identifier
     * @param bucketId the bucket identifier
     * @return {@code true} if an object with the same identifier was replaced
     * @throws StorageException if the object could not be persisted
     */
    boolean store(byte[] payload, String objectId, String bucketId);

    /**
     * Reads an object.
     *
     * @param objectId the object identifier
     * @param bucketId the bucket identifier
     * @return the object content, or empty if the bucket or object does not exist
     * @throws StorageException if the object exists but could not be read
     */
    Optional<byte[]> retrieve(String objectId, String bucketId);

    /**
     * Deletes an object. A bucket whose last object is deleted ceases to exist.
     * Deleting an absent object is not an error, so retrying a delete is safe.
     *
     * @param objectId the object identifier
     * @param bucketId the bucket identifier
     * @return {@code true} if the object existed and was deleted
     * @throws StorageException if the deletion could not be persisted
     */
    boolean delete(String objectId, String bucketId);

    /**
     * Releases all resources. After close, no other methods should be called.
     */
    @Override
    void close();
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link ObjectStore}.
 * <p>
 * Objects live in a nested map {@code bucketId -> objectId -> bytes} guarded by
 * a single read/write lock. All operations are O(1). Nothing survives a restart.
 */
public final class MemoryObjectStore implements ObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryObjectStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, byte[]>> buckets = new HashMap<>();

    @Override
    public boolean store(byte[] payload, String objectId, String bucketId) {
        Identifiers.check(objectId, bucketId);
        byte[] copy = payload == null ? new byte[0] : payload.clone();

        lock.writeLock().lock();
        try {
            Map<String, byte[]> bucket = buckets.computeIfAbsent(bucketId, k -> new HashMap<>());
            boolean replaced = bucket.put(objectId, copy) != null;
            LOG.debug("Stored {}/{} ({} bytes, replaced={})", bucketId, objectId, copy.length, replaced);
            return replaced;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> retrieve(String objectId, String bucketId) {
        Identifiers.check(objectId, bucketId);

        lock.readLock().lock();
        try {
            Map<String, byte[]> bucket = buckets.get(bucketId);
            if (bucket == null) {
                return Optional.empty();
            }
            byte[] payload = bucket.get(objectId);
            return payload == null ? Optional.empty() : Optional.of(payload.clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String objectId, String bucketId) {
        Identifiers.check(objectId, bucketId);

        lock.writeLock().lock();
        try {
            Map<String, byte[]> bucket = buckets.get(bucketId);
            if (bucket == null || bucket.remove(objectId) == null) {
                return false;
            }
            if (bucket.isEmpty()) {
                buckets.remove(bucketId);
                LOG.debug("Bucket {} emptied and removed", bucketId);
            }
            LOG.debug("Deleted {}/{}", bucketId, objectId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of buckets currently holding at least one object. */
    int bucketCount() {
        lock.readLock().lock();
        try {
            return buckets.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        LOG.debug("In-memory store closed");
    }
}

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
package dev.mars.objectstore.storage.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps bucket identifiers to their metadata chains and hands out stripe locks.
 * <p>
 * <b>Lock ordering:</b> the registry lock is always taken before a stripe
 * lock, and released as soon as the stripe lock is held. No code path takes
 * the registry lock while holding a stripe lock. The registry lock guards only
 * the map itself and is never held during file I/O.
 * <p>
 * Because of that ordering, removing an emptied bucket happens in two steps:
 * the bucket is {@linkplain BucketEntry#detach() detached} under its stripe
 * lock, then dropped from the map with {@link #remove(String, BucketEntry)}
 * once the stripe lock is released. Any {@link #acquire} that meets a detached
 * entry in between discards it and carries on as if the bucket were absent.
 */
final class BucketRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BucketRegistry.class);

    static final String BUCKET_FILE_SUFFIX = ".dat";

    private final Path dataDir;
    private final StripeLockManager stripes;
    private final Lock registryLock = new ReentrantLock();
    private final Map<String, BucketEntry> buckets = new HashMap<>();

    BucketRegistry(Path dataDir, StripeLockManager stripes) {
        this.dataDir = dataDir;
        this.stripes = stripes;
    }

    /** Bucket file path for an identifier: {@code <dataDir>/<bucketId>.dat}. */
    Path filePathFor(String bucketId) {
        return dataDir.resolve(bucketId + BUCKET_FILE_SUFFIX);
    }

    /** Creates an entry with a freshly computed stripe index, without registering it. */
    BucketEntry newEntry(String bucketId) {
        return new BucketEntry(bucketId, filePathFor(bucketId), stripes.stripeFor(bucketId));
    }

    /** Registers buckets rebuilt from disk. Used once, before any request is served. */
    void registerAll(Collection<BucketEntry> loaded) {
        registryLock.lock();
        try {
            for (BucketEntry entry : loaded) {
                buckets.put(entry.bucketId(), entry);
            }
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Looks up (or creates) a bucket and locks its stripe.
     *
     * @param bucketId  the bucket identifier
     * @param create    whether to register a new empty bucket if none exists
     * @param exclusive whether to take the stripe's write lock rather than its read lock
     * @return the locked bucket, or {@code null} if absent and {@code create} is false
     */
    LockedBucket acquire(String bucketId, boolean create, boolean exclusive) {
        registryLock.lock();
        try {
            while (true) {
                BucketEntry entry = buckets.get(bucketId);
                if (entry == null) {
                    if (!create) {
                        return null;
                    }
                    entry = newEntry(bucketId);
                    buckets.put(bucketId, entry);
                    LOG.debug("Registered new bucket {} on stripe {}", bucketId, entry.stripeIndex());
                }

                ReadWriteLock stripe = stripes.stripe(entry.stripeIndex());
                Lock lock = exclusive ? stripe.writeLock() : stripe.readLock();
                lock.lock();
                if (!entry.isDetached()) {
                    return new LockedBucket(entry, lock);
                }

                // Emptied by a concurrent delete that has not yet unregistered it
                lock.unlock();
                buckets.remove(bucketId, entry);
            }
        } finally {
            registryLock.unlock();
        }
    }

    Optional<BucketEntry> lookup(String bucketId) {
        registryLock.lock();
        try {
            BucketEntry entry = buckets.get(bucketId);
            return entry == null || entry.isDetached() ? Optional.empty() : Optional.of(entry);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Unregisters a bucket if it is still mapped to {@code entry}.
     * Must not be called while holding a stripe lock.
     */
    void remove(String bucketId, BucketEntry entry) {
        registryLock.lock();
        try {
            if (buckets.remove(bucketId, entry)) {
                LOG.debug("Unregistered bucket {}", bucketId);
            }
        } finally {
            registryLock.unlock();
        }
    }

    int size() {
        registryLock.lock();
        try {
            return buckets.size();
        } finally {
            registryLock.unlock();
        }
    }
}

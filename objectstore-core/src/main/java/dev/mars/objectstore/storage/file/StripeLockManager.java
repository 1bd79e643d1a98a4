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

import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-size array of read/write locks shared by all buckets.
 * <p>
 * A bucket is assigned to one stripe by hashing its identifier. The number of
 * stripes bounds the number of buckets that can be rewritten concurrently, and
 * with it the number of bucket and temporary files open at the same time,
 * independently of how many buckets exist. Buckets that share a stripe exclude
 * each other; arbitration between them is whatever the lock provides.
 */
final class StripeLockManager {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final ReadWriteLock[] stripes;

    StripeLockManager(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be at least 1, was " + stripeCount);
        }
        this.stripes = new ReadWriteLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
    }

    int stripeCount() {
        return stripes.length;
    }

    /** Stripe index for a bucket: unsigned FNV-1 hash of the identifier modulo the stripe count. */
    int stripeFor(String bucketId) {
        return Integer.remainderUnsigned(fnv1(bucketId), stripes.length);
    }

    ReadWriteLock stripe(int index) {
        return stripes[index];
    }

    /** 32-bit FNV-1 over the UTF-8 bytes of {@code s}. */
    static int fnv1(String s) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            hash *= FNV_PRIME;
            hash ^= (b & 0xff);
        }
        return hash;
    }
}

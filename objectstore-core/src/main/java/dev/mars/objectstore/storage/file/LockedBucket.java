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

import java.util.concurrent.locks.Lock;

/**
 * A bucket together with the stripe lock held on its behalf.
 * Closing releases the stripe lock.
 */
final class LockedBucket implements AutoCloseable {

    private final BucketEntry bucket;
    private final Lock lock;

    LockedBucket(BucketEntry bucket, Lock lock) {
        this.bucket = bucket;
        this.lock = lock;
    }

    BucketEntry bucket() {
        return bucket;
    }

    @Override
    public void close() {
        lock.unlock();
    }
}

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BucketRegistry}, in particular the two-step removal of
 * emptied buckets and how {@code acquire} treats a detached entry.
 */
class BucketRegistryTest {

    private StripeLockManager stripes;
    private BucketRegistry registry;

    @BeforeEach
    void setUp() {
        stripes = new StripeLockManager(2);
        registry = new BucketRegistry(Path.of("data"), stripes);
    }

    private BucketEntry create(String bucketId) {
        try (LockedBucket locked = registry.acquire(bucketId, true, true)) {
            return locked.bucket();
        }
    }

    // ========================================================================
    // Lookup and creation
    // ========================================================================

    @Nested
    @DisplayName("Acquire")
    class AcquireTests {

        @Test
        void testAcquire_MissingWithoutCreate_ReturnsNull() {
            assertNull(registry.acquire("b", false, false));
            assertEquals(0, registry.size());
        }

        @Test
        void testAcquire_Create_RegistersOnce() {
            BucketEntry first = create("b");
            BucketEntry second = create("b");

            assertSame(first, second);
            assertEquals(1, registry.size());
            assertEquals(Path.of("data", "b.dat"), first.filePath());
            assertEquals(stripes.stripeFor("b"), first.stripeIndex());
        }

        @Test
        void testAcquire_ReleasesStripeOnClose() {
            BucketEntry entry = create("b");
            ReentrantReadWriteLock stripe = (ReentrantReadWriteLock) stripes.stripe(entry.stripeIndex());

            try (LockedBucket locked = registry.acquire("b", false, true)) {
                assertNotNull(locked);
                assertTrue(stripe.isWriteLockedByCurrentThread());
            }
            assertFalse(stripe.isWriteLocked());

            try (LockedBucket locked = registry.acquire("b", false, false)) {
                assertNotNull(locked);
                assertEquals(1, stripe.getReadLockCount());
            }
            assertEquals(0, stripe.getReadLockCount());
        }
    }

    // ========================================================================
    // Detach and removal
    // ========================================================================

    @Nested
    @DisplayName("Detached buckets")
    class DetachTests {

        @Test
        void testAcquire_DetachedWithoutCreate_PurgesAndReturnsNull() {
            BucketEntry entry = create("b");
            entry.detach();

            assertNull(registry.acquire("b", false, false));
            assertEquals(0, registry.size());
            assertTrue(registry.lookup("b").isEmpty());
        }

        @Test
        void testAcquire_DetachedWithCreate_ReplacesEntry() {
            BucketEntry stale = create("b");
            stale.detach();

            BucketEntry fresh = create("b");

            assertNotSame(stale, fresh);
            assertFalse(fresh.isDetached());
            assertSame(fresh, registry.lookup("b").orElseThrow());
        }

        @Test
        void testRemove_StaleEntry_KeepsReplacement() {
            BucketEntry stale = create("b");
            stale.detach();
            BucketEntry fresh = create("b");

            registry.remove("b", stale);

            assertSame(fresh, registry.lookup("b").orElseThrow());
            assertEquals(1, registry.size());
        }

        @Test
        void testLookup_DetachedEntry_IsAbsent() {
            create("b").detach();

            assertTrue(registry.lookup("b").isEmpty());
        }

        @Test
        void testAcquire_WaitingOnEmptiedBucket_GetsFreshEntry() throws Exception {
            BucketEntry original = create("b");
            ReentrantReadWriteLock stripe = (ReentrantReadWriteLock) stripes.stripe(original.stripeIndex());
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<BucketEntry> waiter;
                try (LockedBucket locked = registry.acquire("b", false, true)) {
                    waiter = executor.submit(() -> {
                        try (LockedBucket other = registry.acquire("b", true, true)) {
                            return other.bucket();
                        }
                    });
                    // The waiter holds the registry lock while queued on the stripe
                    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
                    while (!stripe.hasQueuedThreads()) {
                        assertTrue(System.nanoTime() < deadline, "waiter never queued on the stripe");
                        Thread.sleep(1);
                    }
                    locked.bucket().detach();
                }
                registry.remove("b", original);

                BucketEntry replacement = waiter.get(10, TimeUnit.SECONDS);
                assertNotSame(original, replacement);
                assertFalse(replacement.isDetached());
                assertSame(replacement, registry.lookup("b").orElseThrow());
                assertEquals(1, registry.size());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StripeLockManager}.
 */
class StripeLockManagerTest {

    @ParameterizedTest
    @CsvSource({
            "'',       0x811c9dc5",
            "a,        0x050c5d7e",
            "b1,       0x6f772bf6",
            "bucket,   0x35c8089f"
    })
    void testFnv1_KnownVectors(String input, String expectedHex) {
        int expected = Integer.parseUnsignedInt(expectedHex.substring(2), 16);
        assertEquals(expected, StripeLockManager.fnv1(input));
    }

    @ParameterizedTest
    @CsvSource({
            "a,      46",
            "b1,     14",
            "bucket, 55"
    })
    void testStripeFor_HashModuloStripeCount(String bucketId, int expectedStripe) {
        StripeLockManager stripes = new StripeLockManager(100);
        assertEquals(expectedStripe, stripes.stripeFor(bucketId));
    }

    @Test
    void testStripeFor_StableAndInRange() {
        StripeLockManager stripes = new StripeLockManager(7);
        for (int i = 0; i < 1000; i++) {
            String id = "bucket-" + i;
            int stripe = stripes.stripeFor(id);
            assertTrue(stripe >= 0 && stripe < 7, "stripe out of range: " + stripe);
            assertEquals(stripe, stripes.stripeFor(id));
        }
    }

    @Test
    void testSingleStripe_AllBucketsShareIt() {
        StripeLockManager stripes = new StripeLockManager(1);
        assertEquals(0, stripes.stripeFor("a"));
        assertEquals(0, stripes.stripeFor("zzz"));
        assertSame(stripes.stripe(0), stripes.stripe(stripes.stripeFor("anything")));
    }

    @Test
    void testInvalidStripeCount_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new StripeLockManager(0));
        assertThrows(IllegalArgumentException.class, () -> new StripeLockManager(-3));
    }

    @Test
    void testWriteLock_ExcludesReadersOnSameStripe() throws Exception {
        StripeLockManager stripes = new StripeLockManager(4);
        ReadWriteLock lock = stripes.stripe(2);
        lock.writeLock().lock();
        try {
            CountDownLatch attempted = new CountDownLatch(1);
            boolean[] acquired = new boolean[1];
            Thread reader = new Thread(() -> {
                acquired[0] = lock.readLock().tryLock();
                attempted.countDown();
            });
            reader.start();
            assertTrue(attempted.await(5, TimeUnit.SECONDS));
            reader.join();
            assertFalse(acquired[0]);
        } finally {
            lock.writeLock().unlock();
        }
    }
}

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

import dev.mars.objectstore.config.PropertyResolver;
import dev.mars.objectstore.storage.ObjectStoreConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many writers on overlapping buckets. Each object is owned by one thread, so
 * the expected final state is known even though the interleaving is not. A
 * second scenario shares a single object per bucket so that buckets are
 * repeatedly emptied, unregistered and recreated under contention.
 */
class FileObjectStoreConcurrencyTest {

    private static final int THREADS = 8;
    private static final int OPERATIONS = 200;
    private static final int BUCKETS = 12;
    private static final int EMPTYING_OPERATIONS = 2000;

    @TempDir
    Path tempDir;

    private ObjectStoreConfig config(int stripeCount) {
        return ObjectStoreConfig.builder(PropertyResolver.of(new Properties()))
                .dataDir(tempDir)
                .persist(true)
                .syncEnabled(false)
                .stripeCount(stripeCount)
                .build();
    }

    @Test
    void testConcurrentWriters_ManyStripes() throws Exception {
        runWriters(config(100));
    }

    @Test
    void testConcurrentWriters_SharedStripe() throws Exception {
        runWriters(config(3));
    }

    private void runWriters(ObjectStoreConfig config) throws Exception {
        Map<String, String> expected = new ConcurrentHashMap<>();
        List<String> failures = Collections.synchronizedList(new ArrayList<>());

        try (FileObjectStore store = FileObjectStore.open(config)) {
            ExecutorService executor = Executors.newFixedThreadPool(THREADS);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < THREADS; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    Map<String, String> mine = new HashMap<>();
                    for (int i = 0; i < OPERATIONS; i++) {
                        String bucketId = "b" + ((thread + i) % BUCKETS);
                        String objectId = "t" + thread + "-o" + (i % 5);
                        String key = bucketId + "/" + objectId;
                        if (i % 7 == 6) {
                            boolean deleted = store.delete(objectId, bucketId);
                            if (deleted != mine.containsKey(key)) {
                                failures.add("delete " + key + " returned " + deleted);
                            }
                            mine.remove(key);
                        } else {
                            String value = "v" + i + " from " + thread + "\n" + "x".repeat(i % 40);
                            boolean replaced = store.store(value.getBytes(StandardCharsets.UTF_8), objectId, bucketId);
                            if (replaced != mine.containsKey(key)) {
                                failures.add("store " + key + " returned replaced=" + replaced);
                            }
                            mine.put(key, value);
                        }
                    }
                    expected.putAll(mine);
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(List.of(), failures);
            verify(store, expected);
        }

        // The files on disk describe the same state
        try (FileObjectStore reopened = FileObjectStore.open(config)) {
            verify(reopened, expected);
        }
    }

    /**
     * One shared object per bucket, so buckets are emptied and recreated
     * constantly while other threads are queued on the same stripe.
     */
    @Test
    void testEmptyingBuckets_UnderContention() throws Exception {
        ObjectStoreConfig config = config(2);
        List<String> buckets = List.of("e0", "e1", "e2");
        List<String> failures = Collections.synchronizedList(new ArrayList<>());
        Map<String, String> snapshot;

        try (FileObjectStore store = FileObjectStore.open(config)) {
            ExecutorService executor = Executors.newFixedThreadPool(THREADS);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < THREADS; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    Random random = new Random(thread);
                    start.await();
                    for (int i = 0; i < EMPTYING_OPERATIONS; i++) {
                        String bucketId = buckets.get(random.nextInt(buckets.size()));
                        switch (random.nextInt(3)) {
                            case 0 -> store.store(("t" + thread + "-" + i).getBytes(StandardCharsets.UTF_8),
                                    "o", bucketId);
                            case 1 -> store.delete("o", bucketId);
                            default -> store.retrieve("o", bucketId).ifPresent(payload -> {
                                String value = new String(payload, StandardCharsets.UTF_8);
                                if (!value.matches("t\\d+-\\d+")) {
                                    failures.add("retrieve " + bucketId + " returned '" + value + "'");
                                }
                            });
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(List.of(), failures);
            snapshot = verifyBuckets(store, buckets);
        }

        try (FileObjectStore reopened = FileObjectStore.open(config)) {
            assertEquals(snapshot, verifyBuckets(reopened, buckets));
        }
    }

    /**
     * Checks that the registry, the chains and the files agree, and returns the
     * surviving payloads keyed by bucket.
     */
    private Map<String, String> verifyBuckets(FileObjectStore store, List<String> buckets) throws Exception {
        Map<String, String> payloads = new HashMap<>();
        for (String bucketId : buckets) {
            Path file = store.bucketFilePath(bucketId);
            assertEquals(Files.exists(file), store.hasBucket(bucketId), "registry and file disagree for " + bucketId);
            if (!store.hasBucket(bucketId)) {
                assertEquals(Optional.empty(), store.layout(bucketId));
                continue;
            }

            List<RecordLocation> layout = store.layout(bucketId).orElseThrow();
            assertFalse(layout.isEmpty(), "registered bucket " + bucketId + " has no records");
            long offset = 0;
            for (RecordLocation location : layout) {
                assertEquals(offset, location.offset(), "records must be contiguous in " + bucketId);
                offset += location.headerSize() + location.payloadSize() + ObjectEntry.FRAMING_BYTES;
            }
            assertEquals(Files.size(file), offset, "chain must end at the file size for " + bucketId);

            byte[] payload = store.retrieve("o", bucketId).orElseThrow();
            payloads.put(bucketId, new String(payload, StandardCharsets.UTF_8));
        }

        try (var files = Files.list(tempDir)) {
            assertEquals(List.of(), files.filter(p -> p.toString().endsWith(".tmp")).toList());
        }
        return payloads;
    }

    private static void verify(FileObjectStore store, Map<String, String> expected) {
        for (Map.Entry<String, String> e : expected.entrySet()) {
            String[] parts = e.getKey().split("/");
            byte[] actual = store.retrieve(parts[1], parts[0]).orElseThrow(
                    () -> new AssertionError("missing " + e.getKey()));
            assertEquals(e.getValue(), new String(actual, StandardCharsets.UTF_8), e.getKey());
        }

        int indexed = 0;
        for (int b = 0; b < BUCKETS; b++) {
            List<RecordLocation> layout = store.layout("b" + b).orElse(List.of());
            long offset = 0;
            for (RecordLocation location : layout) {
                assertEquals(offset, location.offset(), "records must be contiguous in b" + b);
                offset += location.headerSize() + location.payloadSize() + ObjectEntry.FRAMING_BYTES;
            }
            indexed += layout.size();
        }
        assertEquals(expected.size(), indexed);
    }
}

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
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the metadata chain kept by {@link BucketEntry}.
 */
class BucketEntryTest {

    private BucketEntry bucket;

    @BeforeEach
    void setUp() {
        bucket = new BucketEntry("b", Path.of("b.dat"), 0);
    }

    /** Appends a record the way the store does: at the current end of the file. */
    private void append(String objectId, int payloadSize) {
        bucket.append(objectId, bucket.fileSize(), RecordCodec.headerSize(objectId, payloadSize), payloadSize);
    }

    @Test
    void testEmptyBucket() {
        assertTrue(bucket.isEmpty());
        assertEquals(0, bucket.fileSize());
        assertTrue(bucket.layout().isEmpty());
    }

    @Test
    void testAppend_RecordsFollowEachOther() {
        append("o1", 1);   // "o1 1 x\n"     = 7 bytes
        append("o2", 3);   // "o2 3 xyz\n"   = 9 bytes

        assertEquals(List.of(
                new RecordLocation("o1", 0, 4, 1),
                new RecordLocation("o2", 7, 4, 3)), bucket.layout());
        assertEquals(16, bucket.fileSize());
        assertEquals(5, bucket.get("o1").payloadOffset());
        assertEquals(7, bucket.get("o1").end());
    }

    @Test
    void testAppend_DuplicateId_Rejected() {
        append("o1", 1);
        assertThrows(IllegalStateException.class, () -> append("o1", 2));
    }

    @Test
    void testAppend_GapInOffsets_Rejected() {
        append("o1", 1);
        assertThrows(IllegalStateException.class, () -> bucket.append("o2", 100, 4, 1));
    }

    @Test
    void testResize_ShiftsOnlyLaterRecords() {
        append("o1", 1);
        append("o2", 1);
        append("o3", 1);

        long delta = bucket.resize("o2", RecordCodec.headerSize("o2", 12), 12);

        assertEquals(12, delta);  // one more length digit, eleven more payload bytes
        List<RecordLocation> layout = bucket.layout();
        assertEquals(0, layout.get(0).offset());
        assertEquals(7, layout.get(1).offset());
        assertEquals(7 + 19, layout.get(2).offset());
        assertEquals(List.of("o1", "o2", "o3"), layout.stream().map(RecordLocation::objectId).toList());
    }

    @Test
    void testResize_Shrink() {
        append("o1", 20);
        append("o2", 1);

        long delta = bucket.resize("o1", RecordCodec.headerSize("o1", 2), 2);

        assertEquals(-19, delta);
        assertEquals(bucket.get("o1").end(), bucket.get("o2").offset());
    }

    @Test
    void testUnlink_Middle_RelinksAndShifts() {
        append("o1", 1);
        append("o2", 3);
        append("o3", 1);

        ObjectEntry removed = bucket.unlink("o2");

        assertEquals(9, removed.recordSize());
        assertEquals(List.of(
                new RecordLocation("o1", 0, 4, 1),
                new RecordLocation("o3", 7, 4, 1)), bucket.layout());
        assertEquals(14, bucket.fileSize());
    }

    @Test
    void testUnlink_HeadAndTail() {
        append("o1", 1);
        append("o2", 1);
        append("o3", 1);

        bucket.unlink("o1");
        assertEquals(0, bucket.get("o2").offset());

        bucket.unlink("o3");
        assertEquals(List.of(new RecordLocation("o2", 0, 4, 1)), bucket.layout());

        // New records continue after the remaining tail
        append("o4", 1);
        assertEquals(7, bucket.get("o4").offset());
    }

    @Test
    void testUnlink_Unknown_Rejected() {
        assertThrows(IllegalStateException.class, () -> bucket.unlink("nope"));
    }

    @Test
    void testDetach_ClearsChain() {
        append("o1", 1);
        bucket.detach();

        assertTrue(bucket.isDetached());
        assertTrue(bucket.isEmpty());
        assertEquals(0, bucket.fileSize());
    }
}

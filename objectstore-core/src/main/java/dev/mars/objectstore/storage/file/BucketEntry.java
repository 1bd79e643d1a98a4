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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata chain of one bucket: every object's location in the bucket file,
 * threaded in physical file order.
 * <p>
 * <b>INVARIANT:</b> for every entry with a successor,
 * {@code next.offset == offset + headerSize + payloadSize + 2}, and the head
 * entry has offset 0. The chain describes exactly the bytes last committed to
 * {@link #filePath()}.
 * <p>
 * Neighbours are linked by object identifier rather than by reference, so
 * appending is O(1) and shifting after a resize or removal walks only the
 * entries physically after the mutated one.
 * <p>
 * <b>Thread Safety:</b> not thread-safe. Callers hold the bucket's stripe lock:
 * the read lock for lookups, the write lock for mutations. The stripe index is
 * fixed for the lifetime of the entry.
 */
final class BucketEntry {

    private final String bucketId;
    private final Path filePath;
    private final int stripeIndex;
    private final Map<String, ObjectEntry> objects = new HashMap<>();
    private String head;
    private String tail;

    /**
     * Set once the bucket has been emptied and its file removed. A detached
     * entry is never mutated again; the registry replaces it on next use.
     */
    private volatile boolean detached;

    BucketEntry(String bucketId, Path filePath, int stripeIndex) {
        this.bucketId = bucketId;
        this.filePath = filePath;
        this.stripeIndex = stripeIndex;
    }

    String bucketId() {
        return bucketId;
    }

    Path filePath() {
        return filePath;
    }

    int stripeIndex() {
        return stripeIndex;
    }

    boolean isDetached() {
        return detached;
    }

    boolean isEmpty() {
        return objects.isEmpty();
    }

    int size() {
        return objects.size();
    }

    ObjectEntry get(String objectId) {
        return objects.get(objectId);
    }

    boolean contains(String objectId) {
        return objects.containsKey(objectId);
    }

    /** Length of the committed bucket file: the end of the tail record, or 0 when empty. */
    long fileSize() {
        return tail == null ? 0L : objects.get(tail).end();
    }

    /**
     * Links a new record as the physical tail.
     *
     * @throws IllegalStateException if the object is already present or the
     *                               offset does not continue the chain
     */
    void append(String objectId, long offset, int headerSize, int payloadSize) {
        if (objects.containsKey(objectId)) {
            throw new IllegalStateException("Object " + bucketId + "/" + objectId + " already indexed");
        }
        if (offset != fileSize()) {
            throw new IllegalStateException("Record " + bucketId + "/" + objectId + " at offset " + offset
                    + " does not follow the tail ending at " + fileSize());
        }
        ObjectEntry entry = new ObjectEntry(offset, headerSize, payloadSize);
        entry.prev = tail;
        if (tail != null) {
            objects.get(tail).next = objectId;
        } else {
            head = objectId;
        }
        objects.put(objectId, entry);
        tail = objectId;
    }

    /**
     * Records a rewritten record that kept its physical slot but may have changed
     * size, shifting every later record by the size difference.
     *
     * @return the size difference applied to later records
     */
    long resize(String objectId, int headerSize, int payloadSize) {
        ObjectEntry entry = require(objectId);
        long delta = ((long) headerSize + payloadSize) - ((long) entry.headerSize + entry.payloadSize);
        if (delta != 0) {
            shiftFrom(entry.next, delta);
        }
        entry.headerSize = headerSize;
        entry.payloadSize = payloadSize;
        return delta;
    }

    /**
     * Removes a record from the chain and pulls every later record back by its size.
     *
     * @return the removed entry
     */
    ObjectEntry unlink(String objectId) {
        ObjectEntry entry = require(objectId);
        objects.remove(objectId);

        if (entry.prev != null) {
            objects.get(entry.prev).next = entry.next;
        } else {
            head = entry.next;
        }
        if (entry.next != null) {
            objects.get(entry.next).prev = entry.prev;
            shiftFrom(entry.next, -entry.recordSize());
        } else {
            tail = entry.prev;
        }
        entry.prev = null;
        entry.next = null;
        return entry;
    }

    /** Marks the bucket as removed and drops its chain. */
    void detach() {
        detached = true;
        objects.clear();
        head = null;
        tail = null;
    }

    /** Snapshot of the chain in physical order. */
    List<RecordLocation> layout() {
        List<RecordLocation> layout = new ArrayList<>(objects.size());
        for (String id = head; id != null; ) {
            ObjectEntry entry = objects.get(id);
            layout.add(new RecordLocation(id, entry.offset, entry.headerSize, entry.payloadSize));
            id = entry.next;
        }
        return layout;
    }

    private void shiftFrom(String objectId, long delta) {
        for (String id = objectId; id != null; ) {
            ObjectEntry entry = objects.get(id);
            entry.offset += delta;
            id = entry.next;
        }
    }

    private ObjectEntry require(String objectId) {
        ObjectEntry entry = objects.get(objectId);
        if (entry == null) {
            throw new IllegalStateException("Object " + bucketId + "/" + objectId + " not indexed");
        }
        return entry;
    }

    @Override
    public String toString() {
        return "BucketEntry{" +
                "bucketId=" + bucketId +
                ", stripe=" + stripeIndex +
                ", objects=" + objects.size() +
                ", fileSize=" + fileSize() +
                ", detached=" + detached +
                '}';
    }
}

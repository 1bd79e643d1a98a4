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

/**
 * Location of one record in a bucket file, plus its physical neighbours.
 * <p>
 * Neighbours are referenced by object identifier and resolved through the
 * owning {@link BucketEntry}. Instances are mutated only by their bucket while
 * the bucket's stripe write lock is held.
 */
final class ObjectEntry {

    /** Separator after the header plus the record terminator. */
    static final int FRAMING_BYTES = 2;

    long offset;
    int headerSize;
    int payloadSize;
    String prev;
    String next;

    ObjectEntry(long offset, int headerSize, int payloadSize) {
        this.offset = offset;
        this.headerSize = headerSize;
        this.payloadSize = payloadSize;
    }

    long offset() {
        return offset;
    }

    int headerSize() {
        return headerSize;
    }

    int payloadSize() {
        return payloadSize;
    }

    /** Total encoded size: header, separator, payload, terminator. */
    long recordSize() {
        return (long) headerSize + payloadSize + FRAMING_BYTES;
    }

    /** File position of the first payload byte. */
    long payloadOffset() {
        return offset + headerSize + 1;
    }

    /** File position just past the terminator byte. */
    long end() {
        return offset + recordSize();
    }
}

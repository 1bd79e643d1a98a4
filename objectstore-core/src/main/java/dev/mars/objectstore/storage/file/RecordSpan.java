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
 * A decoded record header: which object it holds and how many bytes it spans.
 *
 * @param objectId    the object identifier
 * @param headerSize  bytes of {@code "<objectId> <length>"}
 * @param payloadSize bytes of raw object content
 */
record RecordSpan(String objectId, int headerSize, int payloadSize) {

    /** Total encoded size including separator and terminator. */
    long recordSize() {
        return (long) headerSize + payloadSize + ObjectEntry.FRAMING_BYTES;
    }
}

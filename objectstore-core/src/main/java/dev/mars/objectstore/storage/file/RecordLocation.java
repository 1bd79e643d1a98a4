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
 * Immutable snapshot of where a record sits in its bucket file.
 *
 * @param objectId    the object identifier
 * @param offset      byte offset of the identifier field from the start of the file
 * @param headerSize  bytes of {@code "<objectId> <length>"}
 * @param payloadSize bytes of raw object content
 */
record RecordLocation(String objectId, long offset, int headerSize, int payloadSize) {
}

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
/**
 * Object Storage Layer - bucketed object store contract and backends.
 * <p>
 * This package provides the storage abstraction used by the HTTP server:
 * <ul>
 *   <li>{@link dev.mars.objectstore.storage.ObjectStore} - The storage interface</li>
 *   <li>{@link dev.mars.objectstore.storage.MemoryObjectStore} - Volatile in-memory backend</li>
 *   <li>{@link dev.mars.objectstore.storage.file.FileObjectStore} - File-backed backend</li>
 *   <li>{@link dev.mars.objectstore.storage.ObjectStores} - Backend selection from configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Persist-before-response:</b> a file-backed store returns only after its rename is durable</li>
 *   <li><b>Crash safety:</b> bucket files are replaced whole, never patched in place</li>
 *   <li><b>Sequential load:</b> all metadata is rebuilt from the bucket files on startup</li>
 * </ul>
 *
 * @see dev.mars.objectstore.storage.ObjectStore
 */
package dev.mars.objectstore.storage;

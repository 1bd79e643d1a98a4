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
package dev.mars.objectstore.storage;

import dev.mars.objectstore.config.PropertyResolver;
import dev.mars.objectstore.storage.file.FileObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ObjectStoresTest {

    @TempDir
    Path tempDir;

    private ObjectStoreConfig.Builder config() {
        return ObjectStoreConfig.builder(PropertyResolver.of(new Properties())).dataDir(tempDir);
    }

    @Test
    void testOpen_Default_InMemory() {
        try (ObjectStore store = ObjectStores.open(config().build())) {
            assertInstanceOf(MemoryObjectStore.class, store);
            store.store("x".getBytes(StandardCharsets.UTF_8), "o", "b");
        }
        assertFalse(Files.exists(tempDir.resolve("b.dat")));
    }

    @Test
    void testOpen_Persist_FileBacked() {
        try (ObjectStore store = ObjectStores.open(config().persist(true).build())) {
            assertInstanceOf(FileObjectStore.class, store);
            store.store("x".getBytes(StandardCharsets.UTF_8), "o", "b");
        }
        assertTrue(Files.exists(tempDir.resolve("b.dat")));
    }

    @Test
    void testOpen_PersistMissingDirectory_Fails() {
        ObjectStoreConfig config = config().persist(true).dataDir(tempDir.resolve("missing")).build();

        assertThrows(StorageConfigurationException.class, () -> ObjectStores.open(config));
    }
}

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

import dev.mars.objectstore.storage.file.FileObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects and opens the configured {@link ObjectStore} backend.
 */
public final class ObjectStores {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectStores.class);

    private ObjectStores() {
    }

    /**
     * Opens the backend chosen by {@link ObjectStoreConfig#persist()}.
     *
     * @param config the storage configuration
     * @return the file-backed engine when persisting, otherwise the in-memory store
     * @throws StorageConfigurationException if the data directory is unusable
     * @throws StorageException if existing bucket files cannot be loaded
     */
    public static ObjectStore open(ObjectStoreConfig config) {
        if (config.persist()) {
            LOG.info("Using persistent storage in {}", config.dataDir().toAbsolutePath());
            return FileObjectStore.open(config);
        }
        LOG.info("Using in-memory storage");
        return new MemoryObjectStore();
    }
}

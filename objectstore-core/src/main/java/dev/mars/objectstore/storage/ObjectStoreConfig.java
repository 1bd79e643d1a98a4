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

import java.nio.file.Path;

/**
 * Configuration for the object store backends.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dobjectstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code OBJSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code objectstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>objectstore.dataDir</td><td>OBJSTORE_DATA_DIR</td><td>~/.objectstore/data</td></tr>
 *   <tr><td>persist</td><td>objectstore.persist</td><td>OBJSTORE_PERSIST</td><td>false</td></tr>
 *   <tr><td>stripeCount</td><td>objectstore.stripeCount</td><td>OBJSTORE_STRIPE_COUNT</td><td>100</td></tr>
 *   <tr><td>syncEnabled</td><td>objectstore.syncEnabled</td><td>OBJSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>cleanupTempFiles</td><td>objectstore.cleanupTempFiles</td><td>OBJSTORE_CLEANUP_TEMP_FILES</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>objectstore.minFreeSpaceMb</td><td>OBJSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 * </table>
 *
 * <h2>Stripe count</h2>
 * The file engine guards buckets with a fixed number of lock stripes. A larger
 * stripe count lets more distinct buckets be mutated in parallel, at the cost of
 * more simultaneously open file descriptors and lock memory. A smaller count
 * bounds those resources but makes unrelated buckets that hash to the same
 * stripe wait for each other.
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * ObjectStoreConfig config = ObjectStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/objectstore"))
 *     .persist(true)
 *     .build();
 *
 * try (ObjectStore store = ObjectStores.open(config)) {
 *     store.store(bytes, "report", "invoices");
 * }
 * </pre>
 */
public final class ObjectStoreConfig {

    // Property keys
    private static final String PROP_DATA_DIR = "objectstore.dataDir";
    private static final String PROP_PERSIST = "objectstore.persist";
    private static final String PROP_STRIPE_COUNT = "objectstore.stripeCount";
    private static final String PROP_SYNC_ENABLED = "objectstore.syncEnabled";
    private static final String PROP_CLEANUP_TEMP_FILES = "objectstore.cleanupTempFiles";
    private static final String PROP_MIN_FREE_SPACE_MB = "objectstore.minFreeSpaceMb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "OBJSTORE_DATA_DIR";
    private static final String ENV_PERSIST = "OBJSTORE_PERSIST";
    private static final String ENV_STRIPE_COUNT = "OBJSTORE_STRIPE_COUNT";
    private static final String ENV_SYNC_ENABLED = "OBJSTORE_SYNC_ENABLED";
    private static final String ENV_CLEANUP_TEMP_FILES = "OBJSTORE_CLEANUP_TEMP_FILES";
    private static final String ENV_MIN_FREE_SPACE_MB = "OBJSTORE_MIN_FREE_SPACE_MB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".objectstore", "data");
    private static final boolean DEFAULT_PERSIST = false;
    private static final int DEFAULT_STRIPE_COUNT = 100;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_CLEANUP_TEMP_FILES = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;

    private final Path dataDir;
    private final boolean persist;
    private final int stripeCount;
    private final boolean syncEnabled;
    private final boolean cleanupTempFiles;
    private final int minFreeSpaceMb;

    private ObjectStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.persist = builder.persist;
        this.stripeCount = builder.stripeCount;
        this.syncEnabled = builder.syncEnabled;
        this.cleanupTempFiles = builder.cleanupTempFiles;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
    }

    /** Directory holding one {@code <bucketId>.dat} file per bucket. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether the file-backed engine is used instead of the in-memory map. */
    public boolean persist() {
        return persist;
    }

    /** Number of lock stripes shared by all buckets. */
    public int stripeCount() {
        return stripeCount;
    }

    /** Whether rewritten bucket files and the data directory are fsynced (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether temporary files left by interrupted rewrites are deleted at startup. */
    public boolean cleanupTempFiles() {
        return cleanupTempFiles;
    }

    /** Minimum free disk space in MB required before large rewrites. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "ObjectStoreConfig{" +
                "dataDir=" + dataDir +
                ", persist=" + persist +
                ", stripeCount=" + stripeCount +
                ", syncEnabled=" + syncEnabled +
                ", cleanupTempFiles=" + cleanupTempFiles +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and the default properties file.
     */
    public static Builder builder() {
        return new Builder(PropertyResolver.load());
    }

    /**
     * Creates a new builder whose unset values are resolved through the given resolver.
     */
    public static Builder builder(PropertyResolver resolver) {
        return new Builder(resolver);
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ObjectStoreConfig.builder().build()}.
     */
    public static ObjectStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link ObjectStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean persist;
        private Integer stripeCount;
        private Boolean syncEnabled;
        private Boolean cleanupTempFiles;
        private Integer minFreeSpaceMb;

        private final PropertyResolver resolver;

        private Builder(PropertyResolver resolver) {
            this.resolver = resolver;
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Selects the file-backed engine (default: false). */
        public Builder persist(boolean persist) {
            this.persist = persist;
            return this;
        }

        /** Sets the number of lock stripes (default: 100). */
        public Builder stripeCount(int stripeCount) {
            this.stripeCount = stripeCount;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables startup removal of stray temporary files (default: true). */
        public Builder cleanupTempFiles(boolean cleanupTempFiles) {
            this.cleanupTempFiles = cleanupTempFiles;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if the stripe count is not positive
         */
        public ObjectStoreConfig build() {
            if (dataDir == null) {
                dataDir = resolver.resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (persist == null) {
                persist = resolver.resolveBoolean(PROP_PERSIST, ENV_PERSIST, DEFAULT_PERSIST);
            }
            if (stripeCount == null) {
                stripeCount = resolver.resolveInt(PROP_STRIPE_COUNT, ENV_STRIPE_COUNT, DEFAULT_STRIPE_COUNT);
            }
            if (syncEnabled == null) {
                syncEnabled = resolver.resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (cleanupTempFiles == null) {
                cleanupTempFiles = resolver.resolveBoolean(
                        PROP_CLEANUP_TEMP_FILES, ENV_CLEANUP_TEMP_FILES, DEFAULT_CLEANUP_TEMP_FILES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolver.resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }

            if (stripeCount < 1) {
                throw new IllegalArgumentException("stripeCount must be at least 1, was " + stripeCount);
            }
            return new ObjectStoreConfig(this);
        }
    }
}

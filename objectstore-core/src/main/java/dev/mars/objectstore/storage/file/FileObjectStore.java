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

import dev.mars.objectstore.storage.Identifiers;
import dev.mars.objectstore.storage.ObjectStore;
import dev.mars.objectstore.storage.ObjectStoreConfig;
import dev.mars.objectstore.storage.StorageConfigurationException;
import dev.mars.objectstore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * File-backed implementation of {@link ObjectStore}.
 * <p>
 * Each bucket is persisted as one file of records
 * ({@code <objectId> <length> <payload>\n}, see {@link RecordCodec}) and indexed
 * in memory by a {@link BucketEntry} chain holding every record's offset and size.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ objectstore.lock         // exclusive process lock
 *  ├─ &lt;bucketId&gt;.dat           // records of one bucket (atomic replace)
 *  └─ &lt;bucketId&gt;_&lt;n&gt;.tmp       // rewrite in progress
 * </pre>
 * <p>
 * <b>Durability:</b>
 * Every mutation is performed in three steps:
 * <ol>
 *   <li>copy the old bucket data to a temporary file in the data directory,
 *       writing the new record in place of (or after) the old one</li>
 *   <li>force the temp file and atomically rename it over the bucket file,
 *       then force the directory</li>
 *   <li>update the in-memory chain</li>
 * </ol>
 * A failure before the rename leaves both the bucket file and the chain
 * untouched, so the chain always describes the last committed bytes.
 * <p>
 * <b>Thread Safety:</b>
 * Caller threads run operations directly. Buckets are guarded by a fixed set of
 * stripe locks ({@link StripeLockManager}); an operation holds its bucket's
 * stripe lock for its whole duration, so a store becomes visible only once its
 * rename has committed. Buckets on different stripes proceed in parallel.
 *
 * @see ObjectStore
 */
public final class FileObjectStore implements ObjectStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileObjectStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Lock file name */
    static final String LOCK_FILE = "objectstore.lock";

    /** Rewrites producing files larger than this check free disk space first. */
    private static final long LARGE_WRITE_BYTES = 1024 * 1024;

    // ========================================================================
    // State
    // ========================================================================

    private final ObjectStoreConfig config;
    private final Path dataDir;
    private final boolean syncEnabled;
    private final long minFreeSpace;
    private final BucketRegistry registry;

    private FileChannel lockChannel;
    private FileLock dirLock;
    private volatile boolean directorySyncSupported = true;
    private volatile boolean closed = false;

    // ========================================================================
    // Open / Close
    // ========================================================================

    private FileObjectStore(ObjectStoreConfig config) {
        this.config = config;
        this.dataDir = config.dataDir();
        this.syncEnabled = config.syncEnabled();
        this.minFreeSpace = config.minFreeSpaceBytes();
        this.registry = new BucketRegistry(dataDir, new StripeLockManager(config.stripeCount()));
    }

    /**
     * Opens the store: locks the data directory, removes stray temporary files
     * (if enabled) and rebuilds every bucket's chain from its file.
     *
     * @param config the storage configuration
     * @return the ready store
     * @throws StorageConfigurationException if the data directory is missing or inaccessible
     * @throws RecordFormatException         if a bucket file is corrupt
     * @throws StorageException              if the directory is locked by another store or cannot be read
     */
    public static FileObjectStore open(ObjectStoreConfig config) {
        Path dataDir = config.dataDir();
        LOG.info("Opening file store at: {}", dataDir);
        checkDataDir(dataDir);

        FileObjectStore store = new FileObjectStore(config);
        try {
            store.lockDataDir();
            BucketLoader loader = new BucketLoader(dataDir, store.registry);
            if (config.cleanupTempFiles()) {
                loader.removeStrayTempFiles();
            }
            store.registry.registerAll(loader.load());
        } catch (IOException e) {
            LOG.error("Failed to open file store at {}: {}", dataDir, e.getMessage(), e);
            store.unlockDataDir();
            throw new StorageException("Failed to open file store at " + dataDir, e);
        } catch (RuntimeException e) {
            store.unlockDataDir();
            throw e;
        }

        LOG.info("File store opened: path={}, buckets={}, stripes={}, syncEnabled={}",
                dataDir, store.registry.size(), config.stripeCount(), config.syncEnabled());
        if (!config.syncEnabled()) {
            LOG.warn("File store opened with fsync DISABLED. Do NOT use in production!");
        }
        return store;
    }

    /** Returns the configuration used by this store. */
    public ObjectStoreConfig config() {
        return config;
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        unlockDataDir();
        LOG.info("File store closed: {}", dataDir);
    }

    // ========================================================================
    // Store
    // ========================================================================

    @Override
    public boolean store(byte[] payload, String objectId, String bucketId) {
        ensureOpen();
        Identifiers.check(objectId, bucketId);
        byte[] data = payload == null ? new byte[0] : payload;

        BucketEntry abandoned = null;
        try (LockedBucket locked = registry.acquire(bucketId, true, true)) {
            BucketEntry bucket = locked.bucket();
            try {
                return storeLocked(bucket, objectId, data);
            } catch (RuntimeException e) {
                if (bucket.isEmpty()) {
                    // Nothing was ever committed for this bucket
                    bucket.detach();
                    abandoned = bucket;
                }
                throw e;
            }
        } finally {
            if (abandoned != null) {
                registry.remove(bucketId, abandoned);
            }
        }
    }

    private boolean storeLocked(BucketEntry bucket, String objectId, byte[] payload) {
        String bucketId = bucket.bucketId();
        ObjectEntry existing = bucket.get(objectId);
        int newHeaderSize = RecordCodec.headerSize(objectId, payload.length);
        long newRecordSize = (long) newHeaderSize + payload.length + ObjectEntry.FRAMING_BYTES;
        long projectedSize = bucket.fileSize() + newRecordSize - (existing == null ? 0 : existing.recordSize());

        long offset;
        int headerSize;
        Path tmpPath = null;
        try {
            if (projectedSize > LARGE_WRITE_BYTES) {
                checkDiskSpace(bucketId, projectedSize);
            }
            tmpPath = createTempFile(bucketId);

            try (FileChannel out = FileChannel.open(tmpPath, StandardOpenOption.WRITE)) {
                if (existing == null) {
                    if (!bucket.isEmpty()) {
                        try (FileChannel in = FileChannel.open(bucket.filePath(), StandardOpenOption.READ)) {
                            copyRange(in, 0, bucket.fileSize(), out);
                        }
                    }
                    offset = out.position();
                    headerSize = RecordCodec.write(out, objectId, payload);
                } else {
                    offset = existing.offset();
                    try (FileChannel in = FileChannel.open(bucket.filePath(), StandardOpenOption.READ)) {
                        copyRange(in, 0, existing.offset(), out);
                        headerSize = RecordCodec.write(out, objectId, payload);
                        copyRange(in, existing.end(), bucket.fileSize() - existing.end(), out);
                    }
                }
                if (syncEnabled) {
                    out.force(true);
                }
            }

            commit(tmpPath, bucket.filePath());
        } catch (IOException e) {
            LOG.error("Failed to store {}/{}: {}", bucketId, objectId, e.getMessage(), e);
            deleteTempFile(tmpPath);
            throw new StorageException("Failed to store object " + bucketId + "/" + objectId, e);
        } catch (RuntimeException e) {
            deleteTempFile(tmpPath);
            throw e;
        }

        // Committed: bring the chain in line with the file
        if (existing == null) {
            bucket.append(objectId, offset, headerSize, payload.length);
            LOG.debug("Stored {}/{}: offset={}, payloadSize={}", bucketId, objectId, offset, payload.length);
            return false;
        }
        long shift = bucket.resize(objectId, headerSize, payload.length);
        LOG.debug("Replaced {}/{}: offset={}, payloadSize={}, shift={}",
                bucketId, objectId, offset, payload.length, shift);
        return true;
    }

    // ========================================================================
    // Retrieve
    // ========================================================================

    @Override
    public Optional<byte[]> retrieve(String objectId, String bucketId) {
        ensureOpen();
        Identifiers.check(objectId, bucketId);

        try (LockedBucket locked = registry.acquire(bucketId, false, false)) {
            if (locked == null) {
                LOG.trace("Retrieve {}/{}: bucket not found", bucketId, objectId);
                return Optional.empty();
            }
            BucketEntry bucket = locked.bucket();
            ObjectEntry entry = bucket.get(objectId);
            if (entry == null) {
                LOG.trace("Retrieve {}/{}: object not found", bucketId, objectId);
                return Optional.empty();
            }

            ByteBuffer buf = ByteBuffer.allocate(entry.payloadSize());
            try (FileChannel in = FileChannel.open(bucket.filePath(), StandardOpenOption.READ)) {
                long position = entry.payloadOffset();
                while (buf.hasRemaining()) {
                    int n = in.read(buf, position);
                    if (n < 0) {
                        throw new StorageException("Unexpected end of bucket file " + bucket.filePath()
                                + " reading " + bucketId + "/" + objectId + ": expected " + entry.payloadSize()
                                + " bytes at offset " + entry.payloadOffset() + ", got " + buf.position());
                    }
                    position += n;
                }
            } catch (IOException e) {
                LOG.error("Failed to read {}/{}: {}", bucketId, objectId, e.getMessage(), e);
                throw new StorageException("Error reading object " + bucketId + "/" + objectId, e);
            }
            LOG.trace("Retrieved {}/{}: {} bytes", bucketId, objectId, entry.payloadSize());
            return Optional.of(buf.array());
        }
    }

    // ========================================================================
    // Delete
    // ========================================================================

    @Override
    public boolean delete(String objectId, String bucketId) {
        ensureOpen();
        Identifiers.check(objectId, bucketId);

        BucketEntry emptied = null;
        try (LockedBucket locked = registry.acquire(bucketId, false, true)) {
            if (locked == null) {
                return false;
            }
            BucketEntry bucket = locked.bucket();
            ObjectEntry entry = bucket.get(objectId);
            if (entry == null) {
                return false;
            }

            if (bucket.size() == 1) {
                deleteBucketFile(bucket);
                bucket.detach();
                emptied = bucket;
                LOG.debug("Deleted {}/{}, bucket emptied and its file removed", bucketId, objectId);
                return true;
            }

            rewriteWithout(bucket, objectId, entry);
            bucket.unlink(objectId);
            LOG.debug("Deleted {}/{}: {} bytes reclaimed", bucketId, objectId, entry.recordSize());
            return true;
        } finally {
            if (emptied != null) {
                registry.remove(bucketId, emptied);
            }
        }
    }

    private void deleteBucketFile(BucketEntry bucket) {
        try {
            Files.delete(bucket.filePath());
            if (syncEnabled) {
                syncDirectory();
            }
        } catch (IOException e) {
            LOG.error("Failed to delete bucket file {}: {}", bucket.filePath(), e.getMessage(), e);
            throw new StorageException("Failed to delete bucket file " + bucket.filePath(), e);
        }
    }

    private void rewriteWithout(BucketEntry bucket, String objectId, ObjectEntry entry) {
        Path tmpPath = null;
        try {
            tmpPath = createTempFile(bucket.bucketId());
            try (FileChannel out = FileChannel.open(tmpPath, StandardOpenOption.WRITE);
                 FileChannel in = FileChannel.open(bucket.filePath(), StandardOpenOption.READ)) {
                copyRange(in, 0, entry.offset(), out);
                copyRange(in, entry.end(), bucket.fileSize() - entry.end(), out);
                if (syncEnabled) {
                    out.force(true);
                }
            }
            commit(tmpPath, bucket.filePath());
        } catch (IOException e) {
            LOG.error("Failed to delete {}/{}: {}", bucket.bucketId(), objectId, e.getMessage(), e);
            deleteTempFile(tmpPath);
            throw new StorageException("Failed to delete object " + bucket.bucketId() + "/" + objectId, e);
        } catch (RuntimeException e) {
            deleteTempFile(tmpPath);
            throw e;
        }
    }

    // ========================================================================
    // Inspection (package-private, used by tests)
    // ========================================================================

    /** Physical record layout of a bucket, or empty if the bucket does not exist. */
    Optional<List<RecordLocation>> layout(String bucketId) {
        try (LockedBucket locked = registry.acquire(bucketId, false, false)) {
            return locked == null ? Optional.empty() : Optional.of(locked.bucket().layout());
        }
    }

    /** Whether the registry currently holds the bucket. */
    boolean hasBucket(String bucketId) {
        return registry.lookup(bucketId).isPresent();
    }

    Path bucketFilePath(String bucketId) {
        return registry.filePathFor(bucketId);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private Path createTempFile(String bucketId) throws IOException {
        // Same directory as the bucket file so the rename stays on one file system
        return Files.createTempFile(dataDir, bucketId + "_", BucketLoader.TEMP_FILE_SUFFIX);
    }

    /**
     * Atomically replaces {@code target} with {@code tmpPath}, then fsyncs the directory.
     */
    private void commit(Path tmpPath, Path target) throws IOException {
        Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.trace("Atomic rename: {} -> {}", tmpPath, target);
        if (syncEnabled) {
            syncDirectory();
        }
    }

    /** Copies {@code count} bytes starting at {@code position} of {@code in} to the current position of {@code out}. */
    private static void copyRange(FileChannel in, long position, long count, FileChannel out) throws IOException {
        long copied = 0;
        while (copied < count) {
            long n = in.transferTo(position + copied, count - copied, out);
            if (n <= 0) {
                throw new IOException("Unexpected end of file copying " + count + " bytes from offset " + position
                        + " (copied " + copied + ")");
            }
            copied += n;
        }
    }

    private void deleteTempFile(Path tmpPath) {
        if (tmpPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmpPath);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}: {}", tmpPath, e.getMessage());
        }
    }

    /**
     * Forces the data directory so that renames and deletions of bucket files
     * survive a crash. Platforms that cannot open a directory for reading
     * (Windows) or refuse to force one report it once; the store then relies
     * on file-level forces alone.
     */
    private void syncDirectory() {
        if (!directorySyncSupported) {
            return;
        }
        try (FileChannel dir = FileChannel.open(dataDir, StandardOpenOption.READ)) {
            dir.force(true);
            LOG.trace("Data directory forced: {}", dataDir);
        } catch (IOException e) {
            directorySyncSupported = false;
            LOG.warn("Directory fsync not supported for {}, bucket renames may not survive a crash: {}",
                    dataDir, e.getMessage());
        }
    }

    private static void checkDataDir(Path dataDir) {
        if (!Files.exists(dataDir)) {
            LOG.error("Storage directory does not exist: {}", dataDir);
            throw new StorageConfigurationException("Storage directory does not exist: " + dataDir);
        }
        if (!Files.isDirectory(dataDir)) {
            LOG.error("Storage path is not a directory: {}", dataDir);
            throw new StorageConfigurationException("Storage path is not a directory: " + dataDir);
        }
        if (!Files.isReadable(dataDir) || !Files.isWritable(dataDir)) {
            LOG.error("Cannot access storage directory: {}", dataDir);
            throw new StorageConfigurationException("Cannot access storage directory: " + dataDir);
        }
    }

    /**
     * Takes an exclusive lock on {@code objectstore.lock} so that no second
     * store, in this JVM or another process, rewrites the same bucket files.
     *
     * @throws StorageException if another store holds the directory
     */
    private void lockDataDir() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            channel.close();
            LOG.error("Data directory {} is already in use by another store", dataDir);
            throw new StorageException("Data directory " + dataDir
                    + " is already in use by another store (lock held on " + lockPath + ")");
        }

        lockChannel = channel;
        dirLock = lock;
        LOG.debug("Data directory locked: {}", lockPath);
    }

    /** Releases the directory lock. Safe to call when the lock was never taken. */
    private void unlockDataDir() {
        if (lockChannel == null) {
            return;
        }
        try {
            if (dirLock != null && dirLock.isValid()) {
                dirLock.release();
            }
            lockChannel.close();
            LOG.debug("Data directory unlocked: {}", dataDir);
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", dataDir, e.getMessage());
        } finally {
            lockChannel = null;
            dirLock = null;
        }
    }

    /**
     * Refuses a rewrite whose temporary copy would eat into the configured
     * free-space reserve. The old bucket file stays in place until the rename,
     * so the copy needs its full size on top of what is already used.
     *
     * @param bucketId      the bucket being rewritten
     * @param projectedSize size of the bucket file after the rewrite
     * @throws StorageException if the copy plus the reserve does not fit
     */
    private void checkDiskSpace(String bucketId, long projectedSize) throws IOException {
        long usable = Files.getFileStore(dataDir).getUsableSpace();
        long needed = projectedSize + minFreeSpace;
        LOG.trace("Disk space for bucket {} rewrite: {} bytes needed, {} bytes usable", bucketId, needed, usable);

        if (usable < needed) {
            LOG.error("Insufficient disk space to rewrite bucket {}: {} bytes needed ({} byte copy + {} MB reserve), {} bytes usable",
                    bucketId, needed, projectedSize, minFreeSpace / (1024 * 1024), usable);
            throw new StorageException("Insufficient disk space to rewrite bucket " + bucketId + ": "
                    + needed + " bytes needed, " + usable + " bytes usable");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("File store at " + dataDir + " is closed");
        }
    }
}

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
import dev.mars.objectstore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rebuilds the bucket registry from the files in the data directory.
 * <p>
 * Each {@code <bucketId>.dat} file is parsed sequentially from offset 0 and its
 * metadata chain is rebuilt in physical order purely from the bytes on disk.
 * A file holding no records is deleted. A malformed record aborts the whole
 * load: corrupted buckets must never be silently dropped.
 * <p>
 * Temporary files named {@code <bucketId>_<digits>.tmp} are leftovers from a
 * rewrite interrupted before its rename. They never hold committed data and
 * are deleted when cleanup is enabled.
 */
final class BucketLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BucketLoader.class);

    static final String TEMP_FILE_SUFFIX = ".tmp";

    /** Names produced by {@code Files.createTempFile(dir, bucketId + "_", ".tmp")}. */
    private static final Pattern TEMP_FILE_NAME = Pattern.compile(Identifiers.REGEX + "_[0-9]+\\.tmp");

    private final Path dataDir;
    private final BucketRegistry registry;

    BucketLoader(Path dataDir, BucketRegistry registry) {
        this.dataDir = dataDir;
        this.registry = registry;
    }

    /**
     * Parses every bucket file and returns the non-empty buckets.
     *
     * @throws RecordFormatException if any bucket file is malformed
     * @throws StorageException      if the directory or a file cannot be read
     */
    List<BucketEntry> load() {
        long startTime = System.currentTimeMillis();
        List<BucketEntry> loaded = new ArrayList<>();
        int removedEmpty = 0;
        long objectCount = 0;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(dataDir, "*" + BucketRegistry.BUCKET_FILE_SUFFIX)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                String fileName = file.getFileName().toString();
                String bucketId = fileName.substring(0, fileName.length() - BucketRegistry.BUCKET_FILE_SUFFIX.length());
                if (!Identifiers.isValid(bucketId)) {
                    LOG.warn("Ignoring {}: '{}' is not a valid bucket id", file, bucketId);
                    continue;
                }

                BucketEntry bucket = loadBucket(bucketId, file);
                if (bucket.isEmpty()) {
                    Files.delete(file);
                    removedEmpty++;
                    LOG.info("Removed empty bucket file {}", file);
                    continue;
                }
                loaded.add(bucket);
                objectCount += bucket.size();
            }
        } catch (IOException e) {
            LOG.error("Failed to load buckets from {}: {}", dataDir, e.getMessage(), e);
            throw new StorageException("Failed to load buckets from " + dataDir, e);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        LOG.info("Bucket load complete: {} buckets, {} objects, {} empty files removed, {} ms",
                loaded.size(), objectCount, removedEmpty, elapsed);
        return loaded;
    }

    /**
     * Deletes temporary files left behind by interrupted rewrites.
     *
     * @return the number of files deleted
     */
    int removeStrayTempFiles() {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dataDir, "*" + TEMP_FILE_SUFFIX)) {
            for (Path file : files) {
                if (Files.isRegularFile(file) && TEMP_FILE_NAME.matcher(file.getFileName().toString()).matches()) {
                    Files.delete(file);
                    removed++;
                    LOG.warn("Removed stray temporary file {}", file);
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to clean temporary files in {}: {}", dataDir, e.getMessage(), e);
            throw new StorageException("Failed to clean temporary files in " + dataDir, e);
        }
        return removed;
    }

    private BucketEntry loadBucket(String bucketId, Path file) throws IOException {
        BucketEntry bucket = registry.newEntry(bucketId);
        LOG.debug("Loading bucket {} from {}", bucketId, file);

        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            RecordReader reader = new RecordReader(in);
            long offset = reader.position();
            RecordSpan span;
            while ((span = reader.next()) != null) {
                if (bucket.contains(span.objectId())) {
                    throw new RecordFormatException("Malformed record at offset " + offset
                            + ": duplicate object id " + span.objectId());
                }
                bucket.append(span.objectId(), offset, span.headerSize(), span.payloadSize());
                LOG.trace("Loaded {}/{}: offset={}, headerSize={}, payloadSize={}",
                        bucketId, span.objectId(), offset, span.headerSize(), span.payloadSize());
                offset = reader.position();
            }
        } catch (RecordFormatException e) {
            LOG.error("Corrupt bucket file {}: {}", file, e.getMessage());
            throw new RecordFormatException("Corrupt bucket file " + file + ": " + e.getMessage(), e);
        }
        return bucket;
    }
}

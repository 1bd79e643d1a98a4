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

import java.io.IOException;
import java.io.InputStream;

/**
 * Sequential decoder for bucket files.
 * <p>
 * Reads record headers one after another and skips over payloads, tracking the
 * byte offset of each record. A damaged record is never treated as a torn
 * tail to be truncated: bucket files are only ever replaced whole by an atomic
 * rename, so every anomaly raises {@link RecordFormatException}.
 */
final class RecordReader {

    /** Digits of {@link Integer#MAX_VALUE}. */
    private static final int MAX_LENGTH_DIGITS = 10;

    private final InputStream in;
    private final byte[] scratch = new byte[8192];
    private long position;

    RecordReader(InputStream in) {
        this.in = in;
    }

    /** Offset of the next unread byte, which is the start of the next record. */
    long position() {
        return position;
    }

    /**
     * Decodes the next record header and skips its payload.
     *
     * @return the record, or {@code null} at a clean end of stream
     * @throws RecordFormatException if the record is malformed or truncated
     */
    RecordSpan next() throws IOException {
        long start = position;
        int b = read();
        if (b == -1) {
            return null;
        }

        StringBuilder objectId = new StringBuilder();
        while (b != RecordCodec.SEPARATOR) {
            if (b == -1) {
                throw formatError(start, "unexpected end of file in object identifier");
            }
            if (!Identifiers.isIdentifierByte(b)) {
                throw formatError(start, "invalid byte 0x" + Integer.toHexString(b) + " in object identifier");
            }
            objectId.append((char) b);
            b = read();
        }
        if (objectId.length() == 0) {
            throw formatError(start, "empty object identifier");
        }

        long length = 0;
        int digits = 0;
        b = read();
        while (b != RecordCodec.SEPARATOR) {
            if (b == -1) {
                throw formatError(start, "unexpected end of file in length field");
            }
            if (b < '0' || b > '9') {
                throw formatError(start, "invalid byte 0x" + Integer.toHexString(b) + " in length field");
            }
            if (++digits > MAX_LENGTH_DIGITS) {
                throw formatError(start, "length field too long");
            }
            length = length * 10 + (b - '0');
            b = read();
        }
        if (digits == 0) {
            throw formatError(start, "empty length field");
        }
        if (length > Integer.MAX_VALUE) {
            throw formatError(start, "payload length " + length + " out of range");
        }

        long skipped = skipFully(length);
        if (skipped < length) {
            throw formatError(start, "truncated payload: declared " + length + " bytes, only " + skipped + " remain");
        }

        int terminator = read();
        if (terminator == -1) {
            throw formatError(start, "missing record terminator");
        }
        if (terminator != RecordCodec.TERMINATOR) {
            throw formatError(start, "invalid record terminator 0x" + Integer.toHexString(terminator));
        }

        int headerSize = objectId.length() + 1 + digits;
        return new RecordSpan(objectId.toString(), headerSize, (int) length);
    }

    private int read() throws IOException {
        int b = in.read();
        if (b != -1) {
            position++;
        }
        return b;
    }

    /**
     * Consumes up to {@code count} bytes by reading rather than skipping, since
     * some streams report skips past the end of the underlying file.
     */
    private long skipFully(long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            int n = in.read(scratch, 0, (int) Math.min(scratch.length, remaining));
            if (n == -1) {
                break;
            }
            remaining -= n;
            position += n;
        }
        return count - remaining;
    }

    private static RecordFormatException formatError(long offset, String detail) {
        return new RecordFormatException("Malformed record at offset " + offset + ": " + detail);
    }
}

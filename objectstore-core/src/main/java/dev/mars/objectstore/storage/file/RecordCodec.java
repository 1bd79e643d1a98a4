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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

/**
 * Encoder for the bucket file record format.
 * <p>
 * <b>Record Format:</b>
 * <pre>
 * ┌──────────┬───┬─────────────────┬───┬─────────────┬────┐
 * │ objectId │ ␠ │ length (ASCII)  │ ␠ │ payload     │ \n │
 * └──────────┴───┴─────────────────┴───┴─────────────┴────┘
 *  \______ header ______________/
 * </pre>
 * The payload is not escaped: it may contain spaces and newlines because it
 * is always read by its declared length, never by scanning for a delimiter.
 *
 * @see RecordReader
 */
final class RecordCodec {

    static final byte SEPARATOR = ' ';
    static final byte TERMINATOR = '\n';

    private RecordCodec() {
    }

    /** Header bytes: {@code "<objectId> <payloadLength>"}, without the trailing separator. */
    static byte[] encodeHeader(String objectId, int payloadLength) {
        return (objectId + ' ' + payloadLength).getBytes(StandardCharsets.US_ASCII);
    }

    static int headerSize(String objectId, int payloadLength) {
        return objectId.length() + 1 + Integer.toString(payloadLength).length();
    }

    /** Encodes a complete record into a new array. */
    static byte[] encode(String objectId, byte[] payload) {
        byte[] header = encodeHeader(objectId, payload.length);
        byte[] record = new byte[header.length + payload.length + ObjectEntry.FRAMING_BYTES];
        System.arraycopy(header, 0, record, 0, header.length);
        record[header.length] = SEPARATOR;
        System.arraycopy(payload, 0, record, header.length + 1, payload.length);
        record[record.length - 1] = TERMINATOR;
        return record;
    }

    /**
     * Writes a complete record at the channel's current position.
     *
     * @return the header size of the written record
     */
    static int write(WritableByteChannel channel, String objectId, byte[] payload) throws IOException {
        byte[] header = encodeHeader(objectId, payload.length);
        ByteBuffer head = ByteBuffer.allocate(header.length + 1);
        head.put(header).put(SEPARATOR).flip();
        writeFully(channel, head);
        writeFully(channel, ByteBuffer.wrap(payload));
        writeFully(channel, ByteBuffer.wrap(new byte[]{TERMINATOR}));
        return header.length;
    }

    private static void writeFully(WritableByteChannel channel, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }
}

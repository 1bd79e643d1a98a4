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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecordCodec} and {@link RecordReader}.
 */
class RecordCodecTest {

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static RecordReader reader(String content) {
        return new RecordReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.ISO_8859_1)));
    }

    // ========================================================================
    // Encoding
    // ========================================================================

    @Nested
    @DisplayName("Encoding")
    class EncodingTests {

        @Test
        void testEncode_SimpleRecord() {
            assertArrayEquals(ascii("o1 5 hello\n"), RecordCodec.encode("o1", ascii("hello")));
        }

        @Test
        void testEncode_EmptyPayload() {
            assertArrayEquals(ascii("o1 0 \n"), RecordCodec.encode("o1", new byte[0]));
        }

        @Test
        void testHeaderSize_CountsIdSeparatorAndDigits() {
            assertEquals(4, RecordCodec.headerSize("o1", 5));
            assertEquals(6, RecordCodec.headerSize("o1", 123));
            assertEquals(RecordCodec.encodeHeader("object", 1048576).length, RecordCodec.headerSize("object", 1048576));
        }

        @Test
        void testWrite_MatchesEncodeAndReturnsHeaderSize() throws IOException {
            byte[] payload = ascii("two words\nand a line");
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (WritableByteChannel channel = Channels.newChannel(out)) {
                int headerSize = RecordCodec.write(channel, "doc", payload);
                assertEquals(RecordCodec.headerSize("doc", payload.length), headerSize);
            }
            assertArrayEquals(RecordCodec.encode("doc", payload), out.toByteArray());
        }
    }

    // ========================================================================
    // Decoding
    // ========================================================================

    @Nested
    @DisplayName("Decoding")
    class DecodingTests {

        @Test
        void testNext_EmptyStream_ReturnsNull() throws IOException {
            assertNull(reader("").next());
        }

        @Test
        void testNext_SequentialRecordsWithOffsets() throws IOException {
            RecordReader reader = reader("a 1 x\nbb 3 y z\nc 0 \n");

            assertEquals(0, reader.position());
            assertEquals(new RecordSpan("a", 3, 1), reader.next());
            assertEquals(6, reader.position());
            assertEquals(new RecordSpan("bb", 4, 3), reader.next());
            assertEquals(15, reader.position());
            assertEquals(new RecordSpan("c", 3, 0), reader.next());
            assertEquals(20, reader.position());
            assertNull(reader.next());
        }

        @Test
        void testNext_PayloadWithDelimiters_ReadByLength() throws IOException {
            RecordSpan span = reader("o 6 a \n b\n\n").next();
            assertEquals(new RecordSpan("o", 3, 6), span);
            assertEquals(11, span.recordSize());
        }

        @Test
        void testNext_EncodedRecordIsDecodable() throws IOException {
            byte[] payload = new byte[300];
            for (int i = 0; i < payload.length; i++) {
                payload[i] = (byte) i;
            }
            byte[] record = RecordCodec.encode("bin", payload);
            RecordReader reader = new RecordReader(new ByteArrayInputStream(record));

            RecordSpan span = reader.next();
            assertEquals("bin", span.objectId());
            assertEquals(300, span.payloadSize());
            assertEquals(record.length, span.recordSize());
            assertNull(reader.next());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "o1",             // end of file in identifier
                "o1 5",           // end of file in length
                "o1 5 hel",       // truncated payload
                "o1 5 hello",     // missing terminator
                "o1 5 helloX",    // wrong terminator
                " 5 hello\n",     // empty identifier
                "O1 5 hello\n",   // invalid identifier byte
                "o1  hello\n",    // empty length
                "o1 5a hello\n",  // non-digit length
                "o1 99999999999 x\n"
        })
        void testNext_MalformedRecord_Throws(String content) {
            RecordFormatException e = assertThrows(RecordFormatException.class, () -> reader(content).next());
            assertTrue(e.getMessage().startsWith("Malformed record at offset 0"), e.getMessage());
        }

        @Test
        void testNext_MalformedSecondRecord_ReportsItsOffset() throws IOException {
            RecordReader reader = reader("o1 5 hello\no2 9 short\n");
            assertNotNull(reader.next());
            RecordFormatException e = assertThrows(RecordFormatException.class, reader::next);
            assertTrue(e.getMessage().startsWith("Malformed record at offset 11"), e.getMessage());
        }
    }
}

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.sqlfs.storage;

import dev.mars.sqlfs.core.StreamMode;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FileStreamTest {

    @Test
    void testEmptySentinel() {
        FileStream empty = FileStream.EMPTY;

        assertTrue(empty.isEmptySentinel());
        assertEquals(StreamMode.READ, empty.getMode());
        assertEquals(0, empty.length());
        assertEquals(0, empty.toByteArray().length);
        assertThrows(IllegalStateException.class, () -> empty.write(new byte[1]));

        empty.discard();
        assertTrue(empty.isOpen());
    }

    @Test
    void testOutputStreamAdapterWritesThrough() throws Exception {
        FileStream stream = new FileStream(null, StreamMode.WRITE, 16, null, null);

        try (OutputStream out = stream.openOutputStream()) {
            out.write('a');
            out.write("bc".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals("abc", new String(stream.toByteArray(), StandardCharsets.UTF_8));
        assertEquals(3, stream.length());
    }

    @Test
    void testReservationIsEnforced() {
        FileStream stream = new FileStream(null, StreamMode.WRITE, 4, null, "ab".getBytes());

        stream.write("cd".getBytes());
        assertThrows(IllegalStateException.class, () -> stream.write("e".getBytes()));
        assertEquals(4, stream.length());
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileStream(null, StreamMode.WRITE, -1, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new FileStream(null, StreamMode.WRITE, 1, null, "ab".getBytes()));
    }
}

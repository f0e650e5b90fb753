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
import dev.mars.sqlfs.core.exceptions.ContentNotFoundException;
import dev.mars.sqlfs.core.exceptions.ContentStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryContentStore}, including the shared stream
 * bookkeeping in {@link AbstractContentStore}.
 */
class InMemoryContentStoreTest {

    private InMemoryContentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore(1024);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private String commit(String text) throws ContentStoreException {
        FileStream stream = store.open(StreamMode.WRITE, 256, null, null);
        stream.write(text.getBytes(StandardCharsets.UTF_8));
        return store.commit(stream);
    }

    @Nested
    @DisplayName("Write streams")
    class WriteStreams {

        @Test
        @DisplayName("commit turns staged bytes into a readable object")
        void commitAndRead() throws Exception {
            String id = commit("hello");

            assertTrue(store.contains(id));
            assertEquals("hello", new String(store.read(id), StandardCharsets.UTF_8));
            assertEquals(5, store.size(id));
            assertEquals(1, store.objectCount());
        }

        @Test
        @DisplayName("committed stream records its id and cannot be committed twice")
        void commitOnlyOnce() throws Exception {
            FileStream stream = store.open(StreamMode.WRITE, 16, null, "abc".getBytes());
            String id = store.commit(stream);

            assertEquals(FileStream.State.COMMITTED, stream.getState());
            assertEquals(id, stream.getCommittedId());
            assertThrows(ContentStoreException.class, () -> store.commit(stream));
            assertThrows(IllegalStateException.class, () -> stream.write(new byte[1]));
        }

        @Test
        @DisplayName("reservation is capped by the maximum content size")
        void reservationIsCapped() throws Exception {
            FileStream stream = store.open(StreamMode.WRITE, 1_000_000, null, null);

            assertEquals(1024, stream.getReservedLength());
            stream.write(new byte[1024]);
            assertThrows(IllegalStateException.class, () -> stream.write(new byte[1]));
        }

        @Test
        @DisplayName("negative estimate reserves nothing")
        void negativeEstimate() throws Exception {
            FileStream stream = store.open(StreamMode.WRITE, -5, null, null);
            assertEquals(0, stream.getReservedLength());
        }

        @Test
        @DisplayName("initial bytes larger than the reservation are rejected")
        void initialBytesExceedReservation() {
            assertThrows(ContentStoreException.class,
                    () -> store.open(StreamMode.WRITE, 2, null, "abc".getBytes()));
        }

        @Test
        @DisplayName("editing an object starts from its bytes and leaves it unchanged")
        void editExistingObject() throws Exception {
            String original = commit("v1");

            FileStream edit = store.open(StreamMode.WRITE, 16, original, null);
            assertEquals("v1", new String(edit.toByteArray(), StandardCharsets.UTF_8));
            edit.write("+v2".getBytes(StandardCharsets.UTF_8));
            String edited = store.commit(edit);

            assertNotEquals(original, edited);
            assertEquals("v1", new String(store.read(original), StandardCharsets.UTF_8));
            assertEquals("v1+v2", new String(store.read(edited), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("streams of another store cannot be committed")
        void foreignStream() throws Exception {
            InMemoryContentStore other = new InMemoryContentStore(1024);
            FileStream stream = other.open(StreamMode.WRITE, 4, null, null);

            assertThrows(ContentStoreException.class, () -> store.commit(stream));
        }

        @Test
        @DisplayName("discarded streams cannot be committed")
        void discardedStream() throws Exception {
            FileStream stream = store.open(StreamMode.WRITE, 4, null, "ab".getBytes());
            stream.discard();

            assertEquals(FileStream.State.DISCARDED, stream.getState());
            assertEquals(0, stream.length());
            assertThrows(ContentStoreException.class, () -> store.commit(stream));
        }
    }

    @Nested
    @DisplayName("Read streams")
    class ReadStreams {

        @Test
        void readStreamExposesPayload() throws Exception {
            String id = commit("payload");

            FileStream stream = store.open(StreamMode.READ, 0, id, null);

            assertEquals(StreamMode.READ, stream.getMode());
            assertEquals(id, stream.getSourceId());
            assertEquals("payload", new String(stream.openInputStream().readAllBytes(), StandardCharsets.UTF_8));
            assertThrows(IllegalStateException.class, () -> stream.write(new byte[1]));
            assertThrows(ContentStoreException.class, () -> store.commit(stream));
        }

        @Test
        void readStreamRequiresExistingObject() {
            assertThrows(ContentNotFoundException.class, () -> store.open(StreamMode.READ, 0, null, null));
            assertThrows(ContentNotFoundException.class, () -> store.open(StreamMode.READ, 0, "nope", null));
        }
    }

    @Test
    @DisplayName("duplicate creates an independent object")
    void duplicate() throws Exception {
        String id = commit("data");

        String copy = store.duplicate(id);
        store.release(id);

        assertNotEquals(id, copy);
        assertFalse(store.contains(id));
        assertEquals("data", new String(store.read(copy), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("release of an unknown id is a no-op")
    void releaseUnknown() throws Exception {
        store.release("missing");
        store.release(null);
        assertEquals(0, store.objectCount());
    }

    @Test
    @DisplayName("unknown ids are reported as not found")
    void unknownIds() {
        assertThrows(ContentNotFoundException.class, () -> store.read("missing"));
        assertThrows(ContentNotFoundException.class, () -> store.read(null));
        assertThrows(ContentNotFoundException.class, () -> store.size(null));
        assertThrows(ContentNotFoundException.class, () -> store.duplicate("missing"));
    }

    @Test
    @DisplayName("setFailOnPersist causes commit to fail and leaves the stream open")
    void setFailOnPersist() throws Exception {
        FileStream stream = store.open(StreamMode.WRITE, 4, null, "ab".getBytes());
        store.setFailOnPersist(true);

        assertThrows(ContentStoreException.class, () -> store.commit(stream));
        assertTrue(stream.isOpen());

        store.setFailOnPersist(false);
        assertNotNull(store.commit(stream));
    }

    @Test
    @DisplayName("reads return independent copies")
    void readReturnsCopy() throws Exception {
        String id = commit("abc");
        store.read(id)[0] = 'z';
        assertEquals("abc", new String(store.read(id), StandardCharsets.UTF_8));
    }
}

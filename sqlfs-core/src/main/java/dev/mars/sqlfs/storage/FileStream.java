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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Handle on an in-flight read or write of content.
 *
 * <p>A stream does nothing to the filesystem until it is injected into the tree.
 * Write streams accumulate staged bytes up to their reserved length and may be
 * filled by their owner without holding any filesystem lock; committing them
 * into the content store turns the staged bytes into an immutable object.</p>
 *
 * <p>{@link #EMPTY} is a zero-length read stream returned in place of content
 * the caller may not see.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class FileStream {

    private static final int MAX_INITIAL_BUFFER = 64 * 1024;

    public static final FileStream EMPTY = new FileStream(null, StreamMode.READ, 0, null, new byte[0]);

    public enum State {
        OPEN,
        COMMITTED,
        DISCARDED
    }

    private final ContentStore store;
    private final StreamMode mode;
    private final long reservedLength;
    private final String sourceId;
    private final ByteArrayOutputStream buffer;

    private State state = State.OPEN;
    private String committedId;

    FileStream(ContentStore store, StreamMode mode, long reservedLength, String sourceId, byte[] initialBytes) {
        if (reservedLength < 0) {
            throw new IllegalArgumentException("Reserved length cannot be negative: " + reservedLength);
        }
        byte[] initial = initialBytes != null ? initialBytes : new byte[0];
        if (mode == StreamMode.WRITE && initial.length > reservedLength) {
            throw new IllegalArgumentException("Initial content of " + initial.length +
                    " bytes exceeds reserved length " + reservedLength);
        }
        this.store = store;
        this.mode = mode;
        this.reservedLength = reservedLength;
        this.sourceId = sourceId;
        this.buffer = new ByteArrayOutputStream((int) Math.min(Math.max(reservedLength, initial.length), MAX_INITIAL_BUFFER));
        this.buffer.writeBytes(initial);
    }

    public StreamMode getMode() { return mode; }
    public long getReservedLength() { return reservedLength; }
    public String getSourceId() { return sourceId; }
    public String getCommittedId() { return committedId; }

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isEmptySentinel() {
        return this == EMPTY;
    }

    public synchronized long length() {
        return buffer.size();
    }

    public void write(byte[] data) {
        write(data, 0, data.length);
    }

    /**
     * Append bytes to a staged write stream.
     *
     * @throws IllegalStateException if the stream is a read stream, is no longer open,
     *                               or the write would exceed the reserved length
     */
    public synchronized void write(byte[] data, int offset, int length) {
        if (mode != StreamMode.WRITE) {
            throw new IllegalStateException("Cannot write to a read stream");
        }
        if (state != State.OPEN) {
            throw new IllegalStateException("Cannot write to a stream in state " + state);
        }
        if (buffer.size() + (long) length > reservedLength) {
            throw new IllegalStateException("Write of " + length + " bytes exceeds reserved length " +
                    reservedLength + " (staged " + buffer.size() + ")");
        }
        buffer.write(data, offset, length);
    }

    public synchronized byte[] toByteArray() {
        return buffer.toByteArray();
    }

    public InputStream openInputStream() {
        return new ByteArrayInputStream(toByteArray());
    }

    /**
     * An {@link OutputStream} view for feeding this stream from upload code.
     */
    public OutputStream openOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                FileStream.this.write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                FileStream.this.write(b, off, len);
            }
        };
    }

    /**
     * Drop staged bytes without committing. The sentinel is never discarded.
     */
    public synchronized void discard() {
        if (isEmptySentinel() || state != State.OPEN) {
            return;
        }
        state = State.DISCARDED;
        buffer.reset();
    }

    ContentStore getStore() {
        return store;
    }

    synchronized void markCommitted(String contentId) {
        this.state = State.COMMITTED;
        this.committedId = contentId;
    }

    @Override
    public String toString() {
        return "FileStream{" +
                "mode=" + mode +
                ", state=" + state +
                ", length=" + buffer.size() +
                ", reservedLength=" + reservedLength +
                (sourceId != null ? ", sourceId='" + sourceId + '\'' : "") +
                (committedId != null ? ", committedId='" + committedId + '\'' : "") +
                '}';
    }
}

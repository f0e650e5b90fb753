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

/**
 * Storage Provider Interface for file content.
 *
 * <p>Maps opaque content ids to immutable byte payloads. The tree engine only ever
 * handles ids; payload bytes stay inside the store and the streams it hands out.</p>
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@code InMemoryContentStore} - concurrent map, not durable</li>
 *   <li>{@code FileContentStore} - one blob file per object</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe without external locking.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ContentStore extends AutoCloseable {

    /**
     * Allocates a stream.
     *
     * <p>In write mode the stream reserves {@code estimatedLength} bytes (capped by the
     * store's maximum content size) and starts with the bytes of {@code objectId} when
     * given, otherwise with {@code initialBytes}. In read mode {@code objectId} must name
     * a committed object.</p>
     *
     * @param mode            read or write
     * @param estimatedLength bytes to reserve for a write stream
     * @param objectId        existing object to read, or to start editing from; may be null
     * @param initialBytes    initial staged bytes for a fresh write stream; may be null
     * @return the allocated stream
     * @throws ContentNotFoundException if {@code objectId} is given but unknown, or missing in read mode
     * @throws ContentStoreException    if the backend fails
     */
    FileStream open(StreamMode mode, long estimatedLength, String objectId, byte[] initialBytes)
            throws ContentStoreException;

    /**
     * Finalizes a write stream into an immutable content object.
     *
     * @param stream an open write stream allocated by this store
     * @return the new content id
     * @throws ContentStoreException if the stream is a read stream, foreign, or not open
     */
    String commit(FileStream stream) throws ContentStoreException;

    /**
     * @return the full payload of a committed object
     * @throws ContentNotFoundException if the id is unknown
     */
    byte[] read(String contentId) throws ContentStoreException;

    /**
     * Copies a committed object into a new, independent object.
     *
     * @return the id of the copy
     */
    String duplicate(String contentId) throws ContentStoreException;

    /**
     * Drops a committed object. Releasing an unknown id is a no-op.
     */
    void release(String contentId) throws ContentStoreException;

    boolean contains(String contentId);

    long size(String contentId) throws ContentStoreException;

    int objectCount();

    @Override
    void close();
}

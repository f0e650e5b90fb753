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

import java.util.UUID;
import java.util.logging.Logger;

/**
 * Stream bookkeeping shared by the content store backends. Subclasses only
 * provide raw object persistence.
 */
public abstract class AbstractContentStore implements ContentStore {

    private static final Logger logger = Logger.getLogger(AbstractContentStore.class.getName());

    private final long maxContentSize;

    protected AbstractContentStore(long maxContentSize) {
        if (maxContentSize <= 0) {
            throw new IllegalArgumentException("Maximum content size must be positive: " + maxContentSize);
        }
        this.maxContentSize = maxContentSize;
    }

    public long getMaxContentSize() {
        return maxContentSize;
    }

    @Override
    public FileStream open(StreamMode mode, long estimatedLength, String objectId, byte[] initialBytes)
            throws ContentStoreException {
        if (mode == null) {
            throw new IllegalArgumentException("Stream mode cannot be null");
        }
        if (mode == StreamMode.READ) {
            if (objectId == null || objectId.isBlank()) {
                throw new ContentNotFoundException(String.valueOf(objectId));
            }
            byte[] payload = read(objectId);
            return new FileStream(this, StreamMode.READ, payload.length, objectId, payload);
        }

        long reserved = Math.min(Math.max(estimatedLength, 0), maxContentSize);
        byte[] initial = initialBytes;
        if (objectId != null && !objectId.isBlank()) {
            initial = read(objectId);
            reserved = Math.max(reserved, Math.min(initial.length, maxContentSize));
        }
        if (initial != null && initial.length > reserved) {
            throw new ContentStoreException(objectId, "Initial content of " + initial.length +
                    " bytes exceeds reservation of " + reserved + " bytes");
        }
        logger.fine("Allocated write stream reserving " + reserved + " bytes");
        return new FileStream(this, StreamMode.WRITE, reserved, objectId, initial);
    }

    @Override
    public String commit(FileStream stream) throws ContentStoreException {
        if (stream == null) {
            throw new IllegalArgumentException("Stream cannot be null");
        }
        synchronized (stream) {
            if (stream.getStore() != this) {
                throw new ContentStoreException(stream.getSourceId(), "Stream was not allocated by this store");
            }
            if (stream.getMode() != StreamMode.WRITE) {
                throw new ContentStoreException(stream.getSourceId(), "Cannot commit a read stream");
            }
            if (!stream.isOpen()) {
                throw new ContentStoreException(stream.getCommittedId(), "Cannot commit a stream in state " + stream.getState());
            }

            String contentId = newContentId();
            byte[] payload = stream.toByteArray();
            persist(contentId, payload);
            stream.markCommitted(contentId);
            logger.fine("Committed content " + contentId + " (" + payload.length + " bytes)");
            return contentId;
        }
    }

    @Override
    public byte[] read(String contentId) throws ContentStoreException {
        if (contentId == null || !exists(contentId)) {
            throw new ContentNotFoundException(String.valueOf(contentId));
        }
        return load(contentId);
    }

    @Override
    public String duplicate(String contentId) throws ContentStoreException {
        byte[] payload = read(contentId);
        String copyId = newContentId();
        persist(copyId, payload);
        logger.fine("Duplicated content " + contentId + " -> " + copyId);
        return copyId;
    }

    @Override
    public void release(String contentId) throws ContentStoreException {
        if (contentId == null || !exists(contentId)) {
            logger.fine("Release of unknown content ignored: " + contentId);
            return;
        }
        erase(contentId);
        logger.fine("Released content " + contentId);
    }

    @Override
    public boolean contains(String contentId) {
        return contentId != null && exists(contentId);
    }

    @Override
    public long size(String contentId) throws ContentStoreException {
        return read(contentId).length;
    }

    protected String newContentId() {
        return UUID.randomUUID().toString();
    }

    protected abstract boolean exists(String contentId);

    protected abstract byte[] load(String contentId) throws ContentStoreException;

    protected abstract void persist(String contentId, byte[] payload) throws ContentStoreException;

    protected abstract void erase(String contentId) throws ContentStoreException;
}

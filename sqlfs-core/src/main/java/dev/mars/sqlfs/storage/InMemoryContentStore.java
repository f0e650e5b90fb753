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

import dev.mars.sqlfs.core.exceptions.ContentNotFoundException;
import dev.mars.sqlfs.core.exceptions.ContentStoreException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ContentStore}.
 *
 * <p><b>WARNING: NOT DURABLE.</b> All content is lost when the process terminates.
 * Suitable for development and testing; {@link #setFailOnPersist(boolean)} lets tests
 * exercise backend failure handling.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class InMemoryContentStore extends AbstractContentStore {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private volatile boolean failOnPersist = false;

    public InMemoryContentStore(long maxContentSize) {
        super(maxContentSize);
    }

    @Override
    protected boolean exists(String contentId) {
        return objects.containsKey(contentId);
    }

    @Override
    protected byte[] load(String contentId) throws ContentStoreException {
        byte[] payload = objects.get(contentId);
        if (payload == null) {
            throw new ContentNotFoundException(contentId);
        }
        return payload.clone();
    }

    @Override
    protected void persist(String contentId, byte[] payload) throws ContentStoreException {
        if (failOnPersist) {
            throw new ContentStoreException(contentId, "Simulated persist failure");
        }
        objects.put(contentId, payload.clone());
    }

    @Override
    protected void erase(String contentId) {
        objects.remove(contentId);
    }

    @Override
    public long size(String contentId) throws ContentStoreException {
        byte[] payload = contentId != null ? objects.get(contentId) : null;
        if (payload == null) {
            throw new ContentNotFoundException(String.valueOf(contentId));
        }
        return payload.length;
    }

    @Override
    public int objectCount() {
        return objects.size();
    }

    @Override
    public void close() {
        objects.clear();
    }

    // Test Helpers

    public void setFailOnPersist(boolean failOnPersist) {
        this.failOnPersist = failOnPersist;
    }
}

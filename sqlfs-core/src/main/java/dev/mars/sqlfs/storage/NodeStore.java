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

import dev.mars.sqlfs.core.Node;
import dev.mars.sqlfs.core.exceptions.RecordStoreException;

import java.util.List;
import java.util.Optional;

/**
 * Storage Provider Interface for node records.
 *
 * <p>The record store behaves like a table with a primary key on {@code id} and a
 * unique index on {@code (parentId, name)}. It enforces two constraints a relational
 * schema would: at most one root record, and no deletion of a record that still has
 * children.</p>
 *
 * <p><b>Durability Contract:</b> writes are only guaranteed durable after
 * {@link #sync()} returns.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface NodeStore extends AutoCloseable {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Loads persisted records. Idempotent.
     */
    void open() throws RecordStoreException;

    /**
     * Forces pending writes to durable storage. No-op for non-durable stores.
     */
    void sync() throws RecordStoreException;

    /**
     * Reverts every save and delete made since the last successful {@link #sync()},
     * e.g. after the sync of a mutation failed. Ids handed out meanwhile stay used.
     */
    void rollback() throws RecordStoreException;

    @Override
    void close();

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * @return a fresh id, never handed out before by this store
     */
    long nextId();

    Optional<Node> findById(long id);

    Optional<Node> findRoot();

    Optional<Node> findChild(long parentId, String name);

    List<Node> findChildren(long parentId);

    List<Node> findByOwner(String owner);

    int count();

    // =========================================================================
    // Mutations
    // =========================================================================

    /**
     * Inserts or replaces the record with the node's id.
     *
     * @throws RecordStoreException if the node would violate the sibling-name or single-root constraint
     */
    void save(Node node) throws RecordStoreException;

    /**
     * Deletes a record.
     *
     * @throws RecordStoreException if the record is unknown or still has children
     */
    void delete(long id) throws RecordStoreException;
}

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.sqlfs.core.Node;
import dev.mars.sqlfs.core.exceptions.RecordStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Durable {@link NodeStore} backed by a JSON snapshot file.
 *
 * <p>Records live in an {@link InMemoryNodeStore}; {@link #sync()} rewrites
 * {@code nodes.json} through a temporary file and an atomic move when anything
 * changed since the last sync. {@link #open()} reloads the last synced snapshot and
 * {@link #rollback()} discards unsynced changes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FileNodeStore implements NodeStore {

    private static final Logger logger = Logger.getLogger(FileNodeStore.class.getName());

    static final String SNAPSHOT_FILE = "nodes.json";

    private final Path directory;
    private final Path snapshotFile;
    private final InMemoryNodeStore records = new InMemoryNodeStore();
    private final ObjectMapper objectMapper;
    private volatile boolean dirty = false;
    private boolean opened = false;

    public FileNodeStore(Path directory) {
        this.directory = directory;
        this.snapshotFile = directory.resolve(SNAPSHOT_FILE);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }

    @Override
    public synchronized void open() throws RecordStoreException {
        if (opened) {
            return;
        }
        try {
            Files.createDirectories(directory);
            if (Files.exists(snapshotFile)) {
                StoreSnapshot snapshot = objectMapper.readValue(snapshotFile.toFile(), StoreSnapshot.class);
                List<Node> nodes = snapshot.getNodes().stream()
                        .map(NodeSnapshot::toNode)
                        .collect(Collectors.toList());
                records.replaceAll(nodes, snapshot.getSequence());
                logger.info("Loaded " + nodes.size() + " node records from " + snapshotFile);
            } else {
                logger.info("No node snapshot at " + snapshotFile + ", starting empty");
            }
        } catch (IOException e) {
            throw new RecordStoreException("Failed to load node snapshot from " + snapshotFile, e);
        }
        opened = true;
    }

    @Override
    public synchronized void sync() throws RecordStoreException {
        if (!dirty) {
            records.sync();
            return;
        }
        List<NodeSnapshot> nodes = new ArrayList<>();
        for (Node node : records.findAll()) {
            nodes.add(NodeSnapshot.fromNode(node));
        }
        StoreSnapshot snapshot = new StoreSnapshot(records.currentSequence(), Instant.now(), nodes);
        Path temp = directory.resolve(SNAPSHOT_FILE + ".tmp");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to write node snapshot to " + snapshotFile, e);
        }
        records.sync();
        dirty = false;
        logger.fine("Synced " + nodes.size() + " node records to " + snapshotFile);
    }

    /**
     * Returns the records to the last snapshot written by {@link #sync()}.
     */
    @Override
    public synchronized void rollback() {
        records.rollback();
        dirty = false;
    }

    @Override
    public synchronized void close() {
        try {
            sync();
        } catch (RecordStoreException e) {
            throw new IllegalStateException("Failed to sync node store on close", e);
        } finally {
            records.close();
            opened = false;
        }
    }

    @Override
    public long nextId() {
        return records.nextId();
    }

    @Override
    public Optional<Node> findById(long id) {
        return records.findById(id);
    }

    @Override
    public Optional<Node> findRoot() {
        return records.findRoot();
    }

    @Override
    public Optional<Node> findChild(long parentId, String name) {
        return records.findChild(parentId, name);
    }

    @Override
    public List<Node> findChildren(long parentId) {
        return records.findChildren(parentId);
    }

    @Override
    public List<Node> findByOwner(String owner) {
        return records.findByOwner(owner);
    }

    @Override
    public int count() {
        return records.count();
    }

    @Override
    public void save(Node node) throws RecordStoreException {
        records.save(node);
        dirty = true;
    }

    @Override
    public void delete(long id) throws RecordStoreException {
        records.delete(id);
        dirty = true;
    }

    /**
     * On-disk layout of {@code nodes.json}.
     */
    public static class StoreSnapshot {
        private final long sequence;
        private final Instant timestamp;
        private final List<NodeSnapshot> nodes;

        @JsonCreator
        public StoreSnapshot(@JsonProperty("sequence") long sequence,
                             @JsonProperty("timestamp") Instant timestamp,
                             @JsonProperty("nodes") List<NodeSnapshot> nodes) {
            this.sequence = sequence;
            this.timestamp = timestamp;
            this.nodes = nodes != null ? nodes : List.of();
        }

        public long getSequence() { return sequence; }
        public Instant getTimestamp() { return timestamp; }
        public List<NodeSnapshot> getNodes() { return nodes; }
    }
}

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

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Simple in-memory implementation of {@link NodeStore}.
 * This implementation is suitable for development and testing.
 * For durability, wrap it in a {@link FileNodeStore}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryNodeStore implements NodeStore {

    private static final Logger logger = Logger.getLogger(InMemoryNodeStore.class.getName());

    private final Map<Long, Node> nodes = new HashMap<>();
    private final Map<Long, Map<String, Long>> childIndex = new HashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);
    private final Object lock = new Object();
    private Long rootId;

    // Record state before the first change since the last sync; empty for new records
    private final Map<Long, Optional<Node>> journal = new LinkedHashMap<>();

    // Failure injection for testing
    private volatile boolean failOnSync = false;

    @Override
    public void open() {
        // Nothing to load
    }

    /**
     * Not durable: marks the current records as the state {@link #rollback()} returns to.
     */
    @Override
    public void sync() throws RecordStoreException {
        if (failOnSync) {
            throw new RecordStoreException("Simulated sync failure");
        }
        synchronized (lock) {
            journal.clear();
        }
    }

    @Override
    public void rollback() {
        synchronized (lock) {
            if (journal.isEmpty()) {
                return;
            }
            for (Long id : journal.keySet()) {
                detach(id);
            }
            for (Optional<Node> original : journal.values()) {
                original.ifPresent(this::attach);
            }
            logger.fine("Rolled back " + journal.size() + " node records");
            journal.clear();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            nodes.clear();
            childIndex.clear();
            journal.clear();
            rootId = null;
        }
    }

    @Override
    public long nextId() {
        return idSequence.incrementAndGet();
    }

    @Override
    public Optional<Node> findById(long id) {
        synchronized (lock) {
            return Optional.ofNullable(nodes.get(id));
        }
    }

    @Override
    public Optional<Node> findRoot() {
        synchronized (lock) {
            return rootId == null ? Optional.empty() : Optional.ofNullable(nodes.get(rootId));
        }
    }

    @Override
    public Optional<Node> findChild(long parentId, String name) {
        synchronized (lock) {
            Map<String, Long> children = childIndex.get(parentId);
            if (children == null) {
                return Optional.empty();
            }
            Long childId = children.get(name);
            return childId == null ? Optional.empty() : Optional.ofNullable(nodes.get(childId));
        }
    }

    @Override
    public List<Node> findChildren(long parentId) {
        synchronized (lock) {
            Map<String, Long> children = childIndex.get(parentId);
            if (children == null) {
                return List.of();
            }
            return children.values().stream()
                    .map(nodes::get)
                    .sorted(Comparator.comparing(Node::getName))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Node> findByOwner(String owner) {
        synchronized (lock) {
            return nodes.values().stream()
                    .filter(node -> node.getOwner().equals(owner))
                    .sorted(Comparator.comparingLong(Node::getId))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public int count() {
        synchronized (lock) {
            return nodes.size();
        }
    }

    @Override
    public void save(Node node) throws RecordStoreException {
        synchronized (lock) {
            Node existing = nodes.get(node.getId());

            if (node.isRoot()) {
                if (rootId != null && rootId != node.getId()) {
                    throw new RecordStoreException("Root record already exists: " + rootId);
                }
            } else {
                Map<String, Long> siblings = childIndex.get(node.getParentId());
                Long clash = siblings != null ? siblings.get(node.getName()) : null;
                if (clash != null && clash != node.getId()) {
                    throw new RecordStoreException("Duplicate name '" + node.getName() +
                            "' under parent " + node.getParentId());
                }
            }

            journal.putIfAbsent(node.getId(), Optional.ofNullable(existing));
            if (existing != null) {
                detach(existing.getId());
            }
            attach(node);
            bumpSequence(node.getId());
            logger.finest("Saved node record " + node.getId());
        }
    }

    @Override
    public void delete(long id) throws RecordStoreException {
        synchronized (lock) {
            Node existing = nodes.get(id);
            if (existing == null) {
                throw new RecordStoreException("No node record with id " + id);
            }
            Map<String, Long> children = childIndex.get(id);
            if (children != null && !children.isEmpty()) {
                throw new RecordStoreException("Node record " + id + " still has " + children.size() + " children");
            }
            journal.putIfAbsent(id, Optional.of(existing));
            detach(id);
            logger.finest("Deleted node record " + id);
        }
    }

    /**
     * All records in id order. Used for snapshotting.
     */
    List<Node> findAll() {
        synchronized (lock) {
            return nodes.values().stream()
                    .sorted(Comparator.comparingLong(Node::getId))
                    .collect(Collectors.toList());
        }
    }

    long currentSequence() {
        return idSequence.get();
    }

    /**
     * Replaces the whole content of the store, e.g. when loading a snapshot.
     */
    void replaceAll(Collection<Node> records, long sequence) throws RecordStoreException {
        synchronized (lock) {
            close();
            for (Node node : records) {
                save(node);
            }
            idSequence.set(Math.max(idSequence.get(), sequence));
            journal.clear();
        }
    }

    /**
     * Makes {@link #sync()} throw until reset.
     */
    public void setFailOnSync(boolean failOnSync) {
        this.failOnSync = failOnSync;
    }

    private void attach(Node node) {
        nodes.put(node.getId(), node);
        if (node.isRoot()) {
            rootId = node.getId();
        } else {
            childIndex.computeIfAbsent(node.getParentId(), k -> new HashMap<>())
                    .put(node.getName(), node.getId());
        }
    }

    private void detach(long id) {
        Node existing = nodes.remove(id);
        if (existing == null) {
            return;
        }
        if (existing.isRoot()) {
            rootId = null;
        } else {
            unindex(existing);
        }
    }

    private void unindex(Node node) {
        Map<String, Long> siblings = childIndex.get(node.getParentId());
        if (siblings != null) {
            siblings.remove(node.getName(), node.getId());
            if (siblings.isEmpty()) {
                childIndex.remove(node.getParentId());
            }
        }
    }

    private void bumpSequence(long id) {
        idSequence.accumulateAndGet(id, Math::max);
    }
}

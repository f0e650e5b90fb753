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

package dev.mars.sqlfs.filesystem;

import dev.mars.sqlfs.config.SqlfsConfiguration;
import dev.mars.sqlfs.core.exceptions.RecordStoreException;
import dev.mars.sqlfs.filesystem.observability.FilesystemMetrics;
import dev.mars.sqlfs.storage.ContentStore;
import dev.mars.sqlfs.storage.NodeStore;
import dev.mars.sqlfs.storage.StoreFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Owns one filesystem instance: its stores, its lock and its facade.
 *
 * <p>Each context has its own lock, so independent filesystems in one process do
 * not serialize against each other. Contexts are opened explicitly and must be
 * closed to flush and release their stores.</p>
 *
 * <pre>{@code
 * try (FilesystemContext context = FilesystemContext.open(new SqlfsConfiguration())) {
 *     SerializedFilesystem fs = context.filesystem();
 *     fs.createDirectory("/", "docs", FilesystemUser.of("alice"));
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class FilesystemContext implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(FilesystemContext.class.getName());
    private static final AtomicInteger CONTEXT_SEQUENCE = new AtomicInteger();

    private final String name;
    private final SqlfsConfiguration configuration;
    private final NodeStore nodeStore;
    private final ContentStore contentStore;
    private final FilesystemTree tree;
    private final PermissionEngine permissions;
    private final ReentrantReadWriteLock lock;
    private final FilesystemMetrics metrics;
    private final SerializedFilesystem filesystem;
    private final LegacyFilesystem legacy;
    private boolean closed = false;

    private FilesystemContext(Builder builder, NodeStore nodeStore, ContentStore contentStore) {
        this.name = builder.name != null ? builder.name : "sqlfs-" + CONTEXT_SEQUENCE.incrementAndGet();
        this.configuration = builder.configuration;
        this.nodeStore = nodeStore;
        this.contentStore = contentStore;
        this.tree = new FilesystemTree(nodeStore, contentStore, configuration.getSystemOwner());
        this.permissions = new PermissionEngine(tree, configuration.getCreatorGrant());
        this.lock = new ReentrantReadWriteLock(configuration.isFairLocking());
        this.metrics = configuration.isMetricsEnabled() ? FilesystemMetrics.getInstance() : null;
        this.filesystem = new SerializedFilesystem(tree, permissions, nodeStore, contentStore, lock, metrics,
                configuration.getDefaultEstimatedLength());
        this.legacy = new LegacyFilesystem(filesystem);
    }

    /**
     * Opens a context with stores selected by {@code sqlfs.store.type}.
     */
    public static FilesystemContext open(SqlfsConfiguration configuration) throws RecordStoreException {
        return builder().configuration(configuration).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }
    public SqlfsConfiguration getConfiguration() { return configuration; }
    public NodeStore getNodeStore() { return nodeStore; }
    public ContentStore getContentStore() { return contentStore; }
    public FilesystemTree getTree() { return tree; }
    public PermissionEngine getPermissions() { return permissions; }

    public SerializedFilesystem filesystem() {
        return filesystem;
    }

    public LegacyFilesystem legacy() {
        return legacy;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Waits for in-flight operations, then syncs and closes both stores.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        lock.writeLock().lock();
        try {
            if (metrics != null) {
                metrics.unregisterContextGauges(name);
            }
            try {
                nodeStore.close();
            } finally {
                contentStore.close();
            }
            logger.info("Closed filesystem context " + name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Builder for {@link FilesystemContext}. Stores not supplied explicitly are
     * created from the configuration.
     */
    public static class Builder {
        private String name;
        private SqlfsConfiguration configuration;
        private NodeStore nodeStore;
        private ContentStore contentStore;

        public Builder name(String name) { this.name = name; return this; }
        public Builder configuration(SqlfsConfiguration configuration) { this.configuration = configuration; return this; }
        public Builder nodeStore(NodeStore nodeStore) { this.nodeStore = nodeStore; return this; }
        public Builder contentStore(ContentStore contentStore) { this.contentStore = contentStore; return this; }

        /**
         * Opens the record store and creates the root directory if the store is empty.
         *
         * @throws RecordStoreException if the record store cannot be loaded or written
         */
        public FilesystemContext build() throws RecordStoreException {
            if (configuration == null) {
                configuration = new SqlfsConfiguration();
            }
            NodeStore records = nodeStore != null ? nodeStore : StoreFactory.createNodeStore(configuration);
            ContentStore content = contentStore != null ? contentStore : StoreFactory.createContentStore(configuration);

            records.open();
            FilesystemContext context = new FilesystemContext(this, records, content);
            context.tree.initializeRoot(configuration.getRootPermissions());
            records.sync();

            if (context.metrics != null) {
                context.metrics.registerContextGauges(context.name,
                        () -> (long) records.count(),
                        () -> (long) content.objectCount());
            }
            logger.info("Opened filesystem context " + context.name + " (" + records.count() + " nodes)");
            return context;
        }
    }
}

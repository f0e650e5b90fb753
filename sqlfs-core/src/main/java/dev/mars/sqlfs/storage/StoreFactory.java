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

import dev.mars.sqlfs.config.SqlfsConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Factory for creating {@link NodeStore} and {@link ContentStore} instances based on configuration.
 *
 * <p>Supported backends, selected by {@code sqlfs.store.type}:</p>
 * <ul>
 *   <li><b>memory</b> (default) - in-memory stores, not durable</li>
 *   <li><b>file</b> - JSON node snapshot and blob files under {@code sqlfs.store.dir}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StoreFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StoreFactory.class);

    static final String NODES_DIR = "nodes";
    static final String CONTENT_DIR = "content";

    /**
     * Supported storage backend types.
     */
    public enum StoreType {
        /** In-memory storage (testing only, not durable) */
        MEMORY,
        /** JSON snapshot for records, blob files for content */
        FILE
    }

    private StoreFactory() {
        // Utility class
    }

    public static NodeStore createNodeStore(SqlfsConfiguration config) {
        StoreType type = parseStoreType(config.getStoreType());
        LOG.info("Creating NodeStore: type={}", type);

        return switch (type) {
            case MEMORY -> {
                LOG.warn("Using InMemoryNodeStore - DATA WILL NOT SURVIVE RESTART!");
                yield new InMemoryNodeStore();
            }
            case FILE -> {
                Path dir = config.getStoreDirectory().resolve(NODES_DIR);
                LOG.info("Using FileNodeStore at {}", dir);
                yield new FileNodeStore(dir);
            }
        };
    }

    public static ContentStore createContentStore(SqlfsConfiguration config) {
        StoreType type = parseStoreType(config.getStoreType());
        LOG.info("Creating ContentStore: type={}, maxContentSize={}", type, config.getMaxContentSize());

        return switch (type) {
            case MEMORY -> new InMemoryContentStore(config.getMaxContentSize());
            case FILE -> new FileContentStore(config.getStoreDirectory().resolve(CONTENT_DIR),
                    config.getMaxContentSize());
        };
    }

    /**
     * Parses a storage type string into the enum.
     *
     * @param storageType the type string (case-insensitive)
     * @return the parsed type, MEMORY if null or blank
     * @throws IllegalArgumentException if the type is unknown
     */
    public static StoreType parseStoreType(String storageType) {
        if (storageType == null || storageType.isBlank()) {
            return StoreType.MEMORY;
        }
        try {
            return StoreType.valueOf(storageType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown store type: '" + storageType + "'. Supported types: memory, file", e);
        }
    }
}

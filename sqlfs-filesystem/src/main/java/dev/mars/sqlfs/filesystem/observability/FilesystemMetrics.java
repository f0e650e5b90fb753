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

package dev.mars.sqlfs.filesystem.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the filesystem module.
 *
 * Provides:
 * - sqlfs.operations (counter) - Facade operations by name and outcome
 * - sqlfs.permission.denials (counter) - Operations rejected by a permission check
 * - sqlfs.content.bytes_committed (counter) - Bytes linked into the tree
 * - sqlfs.nodes (gauge) - Node records per filesystem context
 * - sqlfs.content.objects (gauge) - Content objects per filesystem context
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FilesystemMetrics {

    private static final Logger logger = LoggerFactory.getLogger(FilesystemMetrics.class);
    private static final String METER_NAME = "sqlfs-filesystem";

    // Singleton instance
    private static FilesystemMetrics instance;

    private final LongCounter operations;
    private final LongCounter permissionDenials;
    private final LongCounter bytesCommitted;

    // Gauge suppliers, registered per filesystem context
    private final ConcurrentHashMap<String, Supplier<Long>> nodeCountSuppliers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Supplier<Long>> contentCountSuppliers = new ConcurrentHashMap<>();

    private static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("operation");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> CONTEXT_KEY = AttributeKey.stringKey("context");

    private FilesystemMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        operations = meter.counterBuilder("sqlfs.operations")
                .setDescription("Filesystem operations by name and outcome")
                .setUnit("1")
                .build();

        permissionDenials = meter.counterBuilder("sqlfs.permission.denials")
                .setDescription("Operations rejected by a permission check")
                .setUnit("1")
                .build();

        bytesCommitted = meter.counterBuilder("sqlfs.content.bytes_committed")
                .setDescription("Bytes of content linked into the tree")
                .setUnit("By")
                .build();

        meter.gaugeBuilder("sqlfs.nodes")
                .setDescription("Node records per filesystem context")
                .ofLongs()
                .buildWithCallback(measurement -> {
                    for (Map.Entry<String, Supplier<Long>> entry : nodeCountSuppliers.entrySet()) {
                        measurement.record(entry.getValue().get(), Attributes.of(CONTEXT_KEY, entry.getKey()));
                    }
                });

        meter.gaugeBuilder("sqlfs.content.objects")
                .setDescription("Content objects per filesystem context")
                .ofLongs()
                .buildWithCallback(measurement -> {
                    for (Map.Entry<String, Supplier<Long>> entry : contentCountSuppliers.entrySet()) {
                        measurement.record(entry.getValue().get(), Attributes.of(CONTEXT_KEY, entry.getKey()));
                    }
                });

        logger.info("FilesystemMetrics initialized");
    }

    /**
     * Get the singleton instance of FilesystemMetrics.
     */
    public static synchronized FilesystemMetrics getInstance() {
        if (instance == null) {
            instance = new FilesystemMetrics();
        }
        return instance;
    }

    public void recordOperation(String operation, String outcome) {
        Attributes attrs = Attributes.builder()
                .put(OPERATION_KEY, operation)
                .put(OUTCOME_KEY, outcome)
                .build();
        operations.add(1, attrs);
    }

    public void recordPermissionDenied(String operation) {
        permissionDenials.add(1, Attributes.of(OPERATION_KEY, operation));
    }

    public void recordBytesCommitted(long bytes) {
        if (bytes > 0) {
            bytesCommitted.add(bytes);
        }
    }

    /**
     * Register gauge suppliers for a filesystem context.
     *
     * @param contextName  the context name used as the gauge attribute
     * @param nodeCount    supplier returning the current node record count
     * @param contentCount supplier returning the current content object count
     */
    public void registerContextGauges(String contextName, Supplier<Long> nodeCount, Supplier<Long> contentCount) {
        nodeCountSuppliers.put(contextName, nodeCount);
        contentCountSuppliers.put(contextName, contentCount);
        logger.debug("Registered gauges for filesystem context {}", contextName);
    }

    public void unregisterContextGauges(String contextName) {
        nodeCountSuppliers.remove(contextName);
        contentCountSuppliers.remove(contextName);
        logger.debug("Unregistered gauges for filesystem context {}", contextName);
    }

    boolean hasContextGauges(String contextName) {
        return nodeCountSuppliers.containsKey(contextName);
    }
}

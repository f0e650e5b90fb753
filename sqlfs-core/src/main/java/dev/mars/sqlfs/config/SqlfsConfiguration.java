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

package dev.mars.sqlfs.config;

import dev.mars.sqlfs.core.Permission;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for SQLFS.
 * Defaults are overridden by {@code sqlfs.properties} and then by {@code sqlfs.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SqlfsConfiguration {
    private static final Logger logger = Logger.getLogger(SqlfsConfiguration.class.getName());

    public static final String SYSTEM_OWNER = "sqlfs.system.owner";
    public static final String CONTENT_MAX_SIZE = "sqlfs.content.max.size";
    public static final String CONTENT_DEFAULT_ESTIMATED_LENGTH = "sqlfs.content.default.estimated.length";
    public static final String STORE_TYPE = "sqlfs.store.type";
    public static final String STORE_DIR = "sqlfs.store.dir";
    public static final String CREATOR_GRANT = "sqlfs.permissions.creator.grant";
    public static final String ROOT_PERMISSIONS = "sqlfs.permissions.root";
    public static final String LOCK_FAIR = "sqlfs.lock.fair";
    public static final String METRICS_ENABLED = "sqlfs.monitoring.metrics.enabled";

    // Default configuration values
    private static final String DEFAULT_SYSTEM_OWNER = "public";
    private static final long DEFAULT_CONTENT_MAX_SIZE = 10L * 1024 * 1024 * 1024; // 10GB
    private static final long DEFAULT_ESTIMATED_LENGTH = 1024 * 1024;
    private static final String DEFAULT_STORE_TYPE = "memory";
    private static final String DEFAULT_STORE_DIR = Paths.get(System.getProperty("java.io.tmpdir"), "sqlfs").toString();
    private static final String DEFAULT_CREATOR_GRANT = "rwx";

    private final Properties properties;

    public SqlfsConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public SqlfsConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Ownership
    public String getSystemOwner() {
        return getStringProperty(SYSTEM_OWNER, DEFAULT_SYSTEM_OWNER);
    }

    // Content store
    public long getMaxContentSize() {
        return getLongProperty(CONTENT_MAX_SIZE, DEFAULT_CONTENT_MAX_SIZE);
    }

    public long getDefaultEstimatedLength() {
        return getLongProperty(CONTENT_DEFAULT_ESTIMATED_LENGTH, DEFAULT_ESTIMATED_LENGTH);
    }

    // Record store
    public String getStoreType() {
        return getStringProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
    }

    public Path getStoreDirectory() {
        return Paths.get(getStringProperty(STORE_DIR, DEFAULT_STORE_DIR));
    }

    // Permissions
    public Permission getCreatorGrant() {
        String value = getStringProperty(CREATOR_GRANT, DEFAULT_CREATOR_GRANT);
        try {
            return Permission.parse(value.trim());
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid creator grant " + value + ". Using default: " + DEFAULT_CREATOR_GRANT);
            return Permission.parse(DEFAULT_CREATOR_GRANT);
        }
    }

    public Map<String, Permission> getRootPermissions() {
        String value = getStringProperty(ROOT_PERMISSIONS, "");
        try {
            return Permission.parseGrants(value);
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid root permissions " + value + ": " + e.getMessage() + ". Using none");
            return Map.of();
        }
    }

    // Concurrency
    public boolean isFairLocking() {
        return getBooleanProperty(LOCK_FAIR, false);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(SYSTEM_OWNER, DEFAULT_SYSTEM_OWNER);
        properties.setProperty(CONTENT_MAX_SIZE, String.valueOf(DEFAULT_CONTENT_MAX_SIZE));
        properties.setProperty(CONTENT_DEFAULT_ESTIMATED_LENGTH, String.valueOf(DEFAULT_ESTIMATED_LENGTH));
        properties.setProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
        properties.setProperty(STORE_DIR, DEFAULT_STORE_DIR);
        properties.setProperty(CREATOR_GRANT, DEFAULT_CREATOR_GRANT);
        properties.setProperty(ROOT_PERMISSIONS, "");
        properties.setProperty(LOCK_FAIR, "false");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "sqlfs.properties",
                "config/sqlfs.properties",
                System.getProperty("user.home") + "/.sqlfs/sqlfs.properties",
                "/etc/sqlfs/sqlfs.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("sqlfs.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("sqlfs."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "SqlfsConfiguration{" +
                "systemOwner='" + getSystemOwner() + '\'' +
                ", storeType='" + getStoreType() + '\'' +
                ", maxContentSize=" + getMaxContentSize() +
                ", creatorGrant=" + getCreatorGrant() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}

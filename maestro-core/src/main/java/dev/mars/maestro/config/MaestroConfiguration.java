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

package dev.mars.maestro.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Configuration for the agent pool and orchestrator.
 *
 * <p>The no-argument constructor resolves each key in layers, highest
 * priority first:
 * <ol>
 *   <li>Environment variable (e.g., MAESTRO_POOL_TIMEOUT_MS)</li>
 *   <li>System property (e.g., -Dmaestro.pool.timeout-ms=60000)</li>
 *   <li>Properties file {@code maestro.properties} on the classpath</li>
 *   <li>Built-in default</li>
 * </ol>
 * The {@link #MaestroConfiguration(Properties)} constructor only layers the
 * given properties over the defaults, which keeps tests independent of the
 * environment.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class MaestroConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(MaestroConfiguration.class);
    private static final String CONFIG_FILE = "maestro.properties";

    public static final String POOL_TIMEOUT_MS = "maestro.pool.timeout-ms";
    public static final String POOL_MAX_RETRIES = "maestro.pool.max-retries";
    public static final String POOL_COOLDOWN_MS = "maestro.pool.cooldown-ms";
    public static final String POOL_RATE_LIMIT_MAX = "maestro.pool.rate-limit.max";
    public static final String POOL_RATE_LIMIT_WINDOW_MS = "maestro.pool.rate-limit.window-ms";
    public static final String POOL_CIRCULAR_UPDATE_THRESHOLD = "maestro.pool.circular-update.threshold";
    public static final String POOL_CIRCULAR_UPDATE_WINDOW_MS = "maestro.pool.circular-update.window-ms";
    public static final String POOL_HISTORY_MAX_SIZE = "maestro.pool.history.max-size";
    public static final String ORCHESTRATOR_MAX_CONCURRENCY = "maestro.orchestrator.max-concurrency";
    public static final String ORCHESTRATOR_SKIP_DEPENDENTS = "maestro.orchestrator.skip-dependents-on-failure";

    // Default configuration values
    private static final long DEFAULT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_COOLDOWN_MS = 0;
    private static final int DEFAULT_RATE_LIMIT_MAX = 10;
    private static final long DEFAULT_RATE_LIMIT_WINDOW_MS = 60000; // 1 minute
    private static final int DEFAULT_CIRCULAR_UPDATE_THRESHOLD = 3;
    private static final long DEFAULT_CIRCULAR_UPDATE_WINDOW_MS = 300000; // 5 minutes
    private static final int DEFAULT_HISTORY_MAX_SIZE = 100;
    private static final int DEFAULT_MAX_CONCURRENCY = 5;
    private static final boolean DEFAULT_SKIP_DEPENDENTS = true;

    private final Properties properties;
    private final boolean layered;

    public MaestroConfiguration() {
        this.properties = new Properties();
        this.layered = true;
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
    }

    public MaestroConfiguration(Properties properties) {
        this.properties = new Properties();
        this.layered = false;
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // ==================== Agent Pool ====================

    public long getDefaultTimeoutMs() {
        return getLong(POOL_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }

    public int getDefaultMaxRetries() {
        return getInt(POOL_MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public long getDefaultCooldownMs() {
        return getLong(POOL_COOLDOWN_MS, DEFAULT_COOLDOWN_MS);
    }

    public int getRateLimitMax() {
        return getInt(POOL_RATE_LIMIT_MAX, DEFAULT_RATE_LIMIT_MAX);
    }

    public long getRateLimitWindowMs() {
        return getLong(POOL_RATE_LIMIT_WINDOW_MS, DEFAULT_RATE_LIMIT_WINDOW_MS);
    }

    public int getCircularUpdateThreshold() {
        return getInt(POOL_CIRCULAR_UPDATE_THRESHOLD, DEFAULT_CIRCULAR_UPDATE_THRESHOLD);
    }

    public long getCircularUpdateWindowMs() {
        return getLong(POOL_CIRCULAR_UPDATE_WINDOW_MS, DEFAULT_CIRCULAR_UPDATE_WINDOW_MS);
    }

    public int getMaxHistorySize() {
        return getInt(POOL_HISTORY_MAX_SIZE, DEFAULT_HISTORY_MAX_SIZE);
    }

    // ==================== Orchestrator ====================

    public int getMaxConcurrency() {
        return getInt(ORCHESTRATOR_MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
    }

    public boolean isSkipDependentsOnFailure() {
        return getBoolean(ORCHESTRATOR_SKIP_DEPENDENTS, DEFAULT_SKIP_DEPENDENTS);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        if (layered) {
            String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }

            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Validates that values are sensible. Called at startup to fail fast on
     * misconfiguration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        requirePositive(POOL_TIMEOUT_MS, getDefaultTimeoutMs());
        requireNonNegative(POOL_MAX_RETRIES, getDefaultMaxRetries());
        requireNonNegative(POOL_COOLDOWN_MS, getDefaultCooldownMs());
        requirePositive(POOL_RATE_LIMIT_MAX, getRateLimitMax());
        requirePositive(POOL_RATE_LIMIT_WINDOW_MS, getRateLimitWindowMs());
        requirePositive(POOL_CIRCULAR_UPDATE_THRESHOLD, getCircularUpdateThreshold());
        requirePositive(POOL_CIRCULAR_UPDATE_WINDOW_MS, getCircularUpdateWindowMs());
        requirePositive(POOL_HISTORY_MAX_SIZE, getMaxHistorySize());
        requirePositive(ORCHESTRATOR_MAX_CONCURRENCY, getMaxConcurrency());
        logger.debug("Maestro configuration validated successfully");
    }

    // ==================== Private Helpers ====================

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " must be positive, got: " + value);
        }
    }

    private static void requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new IllegalStateException(key + " cannot be negative, got: " + value);
        }
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(POOL_TIMEOUT_MS, String.valueOf(DEFAULT_TIMEOUT_MS));
        properties.setProperty(POOL_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(POOL_COOLDOWN_MS, String.valueOf(DEFAULT_COOLDOWN_MS));
        properties.setProperty(POOL_RATE_LIMIT_MAX, String.valueOf(DEFAULT_RATE_LIMIT_MAX));
        properties.setProperty(POOL_RATE_LIMIT_WINDOW_MS, String.valueOf(DEFAULT_RATE_LIMIT_WINDOW_MS));
        properties.setProperty(POOL_CIRCULAR_UPDATE_THRESHOLD, String.valueOf(DEFAULT_CIRCULAR_UPDATE_THRESHOLD));
        properties.setProperty(POOL_CIRCULAR_UPDATE_WINDOW_MS, String.valueOf(DEFAULT_CIRCULAR_UPDATE_WINDOW_MS));
        properties.setProperty(POOL_HISTORY_MAX_SIZE, String.valueOf(DEFAULT_HISTORY_MAX_SIZE));
        properties.setProperty(ORCHESTRATOR_MAX_CONCURRENCY, String.valueOf(DEFAULT_MAX_CONCURRENCY));
        properties.setProperty(ORCHESTRATOR_SKIP_DEPENDENTS, String.valueOf(DEFAULT_SKIP_DEPENDENTS));
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.debug("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from {}: {}", CONFIG_FILE, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "MaestroConfiguration{" +
                "timeoutMs=" + getDefaultTimeoutMs() +
                ", maxRetries=" + getDefaultMaxRetries() +
                ", cooldownMs=" + getDefaultCooldownMs() +
                ", maxHistorySize=" + getMaxHistorySize() +
                ", maxConcurrency=" + getMaxConcurrency() +
                '}';
    }
}

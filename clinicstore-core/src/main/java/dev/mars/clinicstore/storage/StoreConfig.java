/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.clinicstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the appointment store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dclinicstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code CLINICSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code clinicstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>clinicstore.dataDir</td><td>CLINICSTORE_DATA_DIR</td><td>~/.clinicstore/data</td></tr>
 *   <tr><td>cacheCapacity</td><td>clinicstore.cacheCapacity</td><td>CLINICSTORE_CACHE_CAPACITY</td><td>100</td></tr>
 *   <tr><td>cacheTtlSeconds</td><td>clinicstore.cacheTtlSeconds</td><td>CLINICSTORE_CACHE_TTL_SECONDS</td><td>300</td></tr>
 *   <tr><td>backupRetention</td><td>clinicstore.backupRetention</td><td>CLINICSTORE_BACKUP_RETENTION</td><td>5</td></tr>
 *   <tr><td>sweepIntervalSeconds</td><td>clinicstore.sweepIntervalSeconds</td><td>CLINICSTORE_SWEEP_INTERVAL_SECONDS</td><td>30</td></tr>
 *   <tr><td>flushIntervalSeconds</td><td>clinicstore.flushIntervalSeconds</td><td>CLINICSTORE_FLUSH_INTERVAL_SECONDS</td><td>300</td></tr>
 *   <tr><td>syncEnabled</td><td>clinicstore.syncEnabled</td><td>CLINICSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>clinicstore.verifyWrites</td><td>CLINICSTORE_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>clinicstore.minFreeSpaceMb</td><td>CLINICSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # clinicstore.properties
 * clinicstore.dataDir=/var/lib/clinic/data
 * clinicstore.cacheCapacity=500
 * clinicstore.cacheTtlSeconds=120
 * clinicstore.backupRetention=10
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StoreConfig config = StoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/clinic"))
 *     .cacheCapacity(500)
 *     .cacheTtl(Duration.ofMinutes(2))
 *     .build();
 *
 * try (AppointmentStore store = new AppointmentStore(config)) {
 *     store.open();
 * }
 * </pre>
 */
public final class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    private static final String PROPERTIES_FILE = "clinicstore.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "clinicstore.dataDir";
    private static final String PROP_CACHE_CAPACITY = "clinicstore.cacheCapacity";
    private static final String PROP_CACHE_TTL_SECONDS = "clinicstore.cacheTtlSeconds";
    private static final String PROP_BACKUP_RETENTION = "clinicstore.backupRetention";
    private static final String PROP_SWEEP_INTERVAL_SECONDS = "clinicstore.sweepIntervalSeconds";
    private static final String PROP_FLUSH_INTERVAL_SECONDS = "clinicstore.flushIntervalSeconds";
    private static final String PROP_SYNC_ENABLED = "clinicstore.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "clinicstore.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "clinicstore.minFreeSpaceMb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "CLINICSTORE_DATA_DIR";
    private static final String ENV_CACHE_CAPACITY = "CLINICSTORE_CACHE_CAPACITY";
    private static final String ENV_CACHE_TTL_SECONDS = "CLINICSTORE_CACHE_TTL_SECONDS";
    private static final String ENV_BACKUP_RETENTION = "CLINICSTORE_BACKUP_RETENTION";
    private static final String ENV_SWEEP_INTERVAL_SECONDS = "CLINICSTORE_SWEEP_INTERVAL_SECONDS";
    private static final String ENV_FLUSH_INTERVAL_SECONDS = "CLINICSTORE_FLUSH_INTERVAL_SECONDS";
    private static final String ENV_SYNC_ENABLED = "CLINICSTORE_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "CLINICSTORE_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "CLINICSTORE_MIN_FREE_SPACE_MB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".clinicstore", "data");
    private static final int DEFAULT_CACHE_CAPACITY = 100;
    private static final int DEFAULT_CACHE_TTL_SECONDS = 300;
    private static final int DEFAULT_BACKUP_RETENTION = 5;
    private static final int DEFAULT_SWEEP_INTERVAL_SECONDS = 30;
    private static final int DEFAULT_FLUSH_INTERVAL_SECONDS = 300;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;

    private final Path dataDir;
    private final int cacheCapacity;
    private final Duration cacheTtl;
    private final int backupRetention;
    private final Duration sweepInterval;
    private final Duration flushInterval;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;

    private StoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.cacheCapacity = builder.cacheCapacity;
        this.cacheTtl = builder.cacheTtl;
        this.backupRetention = builder.backupRetention;
        this.sweepInterval = builder.sweepInterval;
        this.flushInterval = builder.flushInterval;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
    }

    /** Directory holding the snapshot, its backups and the lock file. */
    public Path dataDir() {
        return dataDir;
    }

    /** Maximum number of cache entries. */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    /** Time-to-live of a cache entry. */
    public Duration cacheTtl() {
        return cacheTtl;
    }

    /** Number of rotated backups kept next to the snapshot. */
    public int backupRetention() {
        return backupRetention;
    }

    /** Interval of the background cache sweep. */
    public Duration sweepInterval() {
        return sweepInterval;
    }

    /** Interval of the background snapshot flush. */
    public Duration flushInterval() {
        return flushInterval;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to read back and decode the temp file before it replaces the snapshot. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "dataDir=" + dataDir +
                ", cacheCapacity=" + cacheCapacity +
                ", cacheTtl=" + cacheTtl +
                ", backupRetention=" + backupRetention +
                ", sweepInterval=" + sweepInterval +
                ", flushInterval=" + flushInterval +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StoreConfig.builder().build()}.
     */
    public static StoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Integer cacheCapacity;
        private Duration cacheTtl;
        private Integer backupRetention;
        private Duration sweepInterval;
        private Duration flushInterval;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Sets the cache capacity (default: 100). */
        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        /** Sets the cache entry time-to-live (default: 5 minutes). */
        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /** Sets how many rotated backups are kept (default: 5). */
        public Builder backupRetention(int backupRetention) {
            this.backupRetention = backupRetention;
            return this;
        }

        /** Sets the cache sweep interval (default: 30 seconds). */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        /** Sets the scheduled flush interval (default: 5 minutes). */
        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public StoreConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (dataDir == null) {
                dataDir = resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (cacheCapacity == null) {
                cacheCapacity = resolveInt(PROP_CACHE_CAPACITY, ENV_CACHE_CAPACITY, DEFAULT_CACHE_CAPACITY);
            }
            if (cacheTtl == null) {
                cacheTtl = Duration.ofSeconds(
                        resolveInt(PROP_CACHE_TTL_SECONDS, ENV_CACHE_TTL_SECONDS, DEFAULT_CACHE_TTL_SECONDS));
            }
            if (backupRetention == null) {
                backupRetention = resolveInt(PROP_BACKUP_RETENTION, ENV_BACKUP_RETENTION, DEFAULT_BACKUP_RETENTION);
            }
            if (sweepInterval == null) {
                sweepInterval = Duration.ofSeconds(
                        resolveInt(PROP_SWEEP_INTERVAL_SECONDS, ENV_SWEEP_INTERVAL_SECONDS, DEFAULT_SWEEP_INTERVAL_SECONDS));
            }
            if (flushInterval == null) {
                flushInterval = Duration.ofSeconds(
                        resolveInt(PROP_FLUSH_INTERVAL_SECONDS, ENV_FLUSH_INTERVAL_SECONDS, DEFAULT_FLUSH_INTERVAL_SECONDS));
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolveBoolean(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }

            validate();
            return new StoreConfig(this);
        }

        private void validate() {
            if (cacheCapacity < 1) {
                throw new IllegalArgumentException("cacheCapacity must be >= 1, was " + cacheCapacity);
            }
            requirePositive(cacheTtl, "cacheTtl");
            if (backupRetention < 0) {
                throw new IllegalArgumentException("backupRetention must be >= 0, was " + backupRetention);
            }
            requirePositive(sweepInterval, "sweepInterval");
            requirePositive(flushInterval, "flushInterval");
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must be >= 0, was " + minFreeSpaceMb);
            }
        }

        private static void requirePositive(Duration value, String name) {
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, was " + value);
            }
        }

        private String lookup(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            return null;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Path.of(value) : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    LOG.debug("Loaded {} from classpath", PROPERTIES_FILE);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                    LOG.debug("Loaded {} from working directory", localFile.toAbsolutePath());
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}

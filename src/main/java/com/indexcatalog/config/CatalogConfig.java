package com.indexcatalog.config;

import com.indexcatalog.core.ReplayPolicy;
import com.indexcatalog.exception.ConfigurationException;
import com.indexcatalog.exception.ErrorCode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Configuration for the catalog.
 * <p>
 * Each setting is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dcatalog.tableName=users})</li>
 *   <li>Environment variables (e.g., {@code TABLE_CATALOG_NAME})</li>
 *   <li>Properties file ({@code index-catalog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <table border="1">
 *   <tr><th>Setting</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>S3 bucket</td><td>catalog.s3Bucket</td><td>CATALOG_S3_BUCKET</td><td>required</td></tr>
 *   <tr><td>S3 region</td><td>catalog.s3Region</td><td>CATALOG_S3_REGION</td><td>us-east-1</td></tr>
 *   <tr><td>S3 endpoint</td><td>catalog.s3Endpoint</td><td>CATALOG_S3_ENDPOINT</td><td>none</td></tr>
 *   <tr><td>Index table</td><td>catalog.tableName</td><td>TABLE_CATALOG_NAME</td><td>required</td></tr>
 *   <tr><td>WAL table</td><td>catalog.walTableName</td><td>TABLE_CATALOG_WAL_NAME</td><td>{table}_WAL</td></tr>
 *   <tr><td>Index keys</td><td>catalog.indexKeys</td><td>TABLE_CATALOG_INDEX_KEYS</td><td>required</td></tr>
 *   <tr><td>Primary field</td><td>catalog.rowKey</td><td>TABLE_CATALOG_ROW_KEY</td><td>required</td></tr>
 *   <tr><td>Replay policy</td><td>catalog.replayPolicy</td><td>TABLE_CATALOG_REPLAY_POLICY</td><td>CATCH_UP</td></tr>
 *   <tr><td>Recovery interval (s)</td><td>catalog.recoveryIntervalSeconds</td>
 *       <td>TABLE_CATALOG_RECOVERY_INTERVAL_SECONDS</td><td>30</td></tr>
 * </table>
 */
public final class CatalogConfig {

    static final String PROPERTIES_FILE = "index-catalog.properties";

    static final String PROP_S3_BUCKET = "catalog.s3Bucket";
    static final String PROP_S3_REGION = "catalog.s3Region";
    static final String PROP_S3_ENDPOINT = "catalog.s3Endpoint";
    static final String PROP_TABLE_NAME = "catalog.tableName";
    static final String PROP_WAL_TABLE_NAME = "catalog.walTableName";
    static final String PROP_INDEX_KEYS = "catalog.indexKeys";
    static final String PROP_ROW_KEY = "catalog.rowKey";
    static final String PROP_REPLAY_POLICY = "catalog.replayPolicy";
    static final String PROP_RECOVERY_INTERVAL = "catalog.recoveryIntervalSeconds";

    static final String ENV_S3_BUCKET = "CATALOG_S3_BUCKET";
    static final String ENV_S3_REGION = "CATALOG_S3_REGION";
    static final String ENV_S3_ENDPOINT = "CATALOG_S3_ENDPOINT";
    static final String ENV_TABLE_NAME = "TABLE_CATALOG_NAME";
    static final String ENV_WAL_TABLE_NAME = "TABLE_CATALOG_WAL_NAME";
    static final String ENV_INDEX_KEYS = "TABLE_CATALOG_INDEX_KEYS";
    static final String ENV_ROW_KEY = "TABLE_CATALOG_ROW_KEY";
    static final String ENV_REPLAY_POLICY = "TABLE_CATALOG_REPLAY_POLICY";
    static final String ENV_RECOVERY_INTERVAL = "TABLE_CATALOG_RECOVERY_INTERVAL_SECONDS";

    private static final String DEFAULT_S3_REGION = "us-east-1";
    private static final String WAL_TABLE_SUFFIX = "_WAL";
    private static final ReplayPolicy DEFAULT_REPLAY_POLICY = ReplayPolicy.CATCH_UP;
    private static final long DEFAULT_RECOVERY_INTERVAL_SECONDS = 30;

    private final String s3Bucket;
    private final String s3Region;
    private final String s3Endpoint;
    private final String tableName;
    private final String walTableName;
    private final List<String> indexKeys;
    private final String primaryField;
    private final ReplayPolicy replayPolicy;
    private final Duration recoveryInterval;

    private CatalogConfig(Builder builder) {
        this.s3Bucket = builder.s3Bucket;
        this.s3Region = builder.s3Region;
        this.s3Endpoint = builder.s3Endpoint;
        this.tableName = builder.tableName;
        this.walTableName = builder.walTableName;
        this.indexKeys = List.copyOf(builder.indexKeys);
        this.primaryField = builder.primaryField;
        this.replayPolicy = builder.replayPolicy;
        this.recoveryInterval = builder.recoveryInterval;
    }

    public String getS3Bucket() { return s3Bucket; }
    public String getS3Region() { return s3Region; }

    /** Endpoint override for S3-compatible stores; empty for AWS. */
    public Optional<String> getS3Endpoint() { return Optional.ofNullable(s3Endpoint); }

    public String getTableName() { return tableName; }
    public String getWalTableName() { return walTableName; }
    public List<String> getIndexKeys() { return indexKeys; }
    public String getPrimaryField() { return primaryField; }
    public ReplayPolicy getReplayPolicy() { return replayPolicy; }
    public Duration getRecoveryInterval() { return recoveryInterval; }

    @Override
    public String toString() {
        return "CatalogConfig{" +
                "s3Bucket=" + s3Bucket +
                ", s3Region=" + s3Region +
                ", s3Endpoint=" + s3Endpoint +
                ", tableName=" + tableName +
                ", walTableName=" + walTableName +
                ", indexKeys=" + indexKeys +
                ", primaryField=" + primaryField +
                ", replayPolicy=" + replayPolicy +
                ", recoveryInterval=" + recoveryInterval +
                '}';
    }

    public static Builder builder() {
        return new Builder(loadPropertiesFile());
    }

    /**
     * Builder that reads file-level settings from {@code fileProperties} instead of
     * {@value #PROPERTIES_FILE}.
     */
    static Builder builder(Properties fileProperties) {
        return new Builder(fileProperties);
    }

    /**
     * Loads configuration from all sources. Shorthand for {@code CatalogConfig.builder().build()}.
     */
    public static CatalogConfig load() throws ConfigurationException {
        return builder().build();
    }

    /**
     * Builder for {@link CatalogConfig}. Unset values are resolved from system
     * properties, environment variables, the properties file, or defaults.
     */
    public static final class Builder {
        private String s3Bucket;
        private String s3Region;
        private String s3Endpoint;
        private String tableName;
        private String walTableName;
        private List<String> indexKeys;
        private String primaryField;
        private ReplayPolicy replayPolicy;
        private Duration recoveryInterval;

        private final Properties fileProperties;

        private Builder(Properties fileProperties) {
            this.fileProperties = fileProperties;
        }

        public Builder s3Bucket(String bucket) {
            this.s3Bucket = bucket;
            return this;
        }

        public Builder s3Region(String region) {
            this.s3Region = region;
            return this;
        }

        public Builder s3Endpoint(String endpoint) {
            this.s3Endpoint = endpoint;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder walTableName(String walTableName) {
            this.walTableName = walTableName;
            return this;
        }

        public Builder indexKeys(List<String> indexKeys) {
            this.indexKeys = new ArrayList<>(indexKeys);
            return this;
        }

        /** Sets index keys from a comma-separated list. */
        public Builder indexKeys(String commaSeparated) {
            this.indexKeys = splitKeys(commaSeparated);
            return this;
        }

        public Builder primaryField(String primaryField) {
            this.primaryField = primaryField;
            return this;
        }

        public Builder replayPolicy(ReplayPolicy replayPolicy) {
            this.replayPolicy = replayPolicy;
            return this;
        }

        public Builder recoveryInterval(Duration interval) {
            this.recoveryInterval = interval;
            return this;
        }

        /**
         * @throws ConfigurationException if a required setting is missing or malformed
         */
        public CatalogConfig build() throws ConfigurationException {
            if (s3Bucket == null) {
                s3Bucket = require(PROP_S3_BUCKET, ENV_S3_BUCKET);
            }
            if (s3Region == null) {
                s3Region = resolve(PROP_S3_REGION, ENV_S3_REGION).orElse(DEFAULT_S3_REGION);
            }
            if (s3Endpoint == null) {
                s3Endpoint = resolve(PROP_S3_ENDPOINT, ENV_S3_ENDPOINT).orElse(null);
            }
            if (tableName == null) {
                tableName = require(PROP_TABLE_NAME, ENV_TABLE_NAME);
            }
            if (walTableName == null) {
                walTableName = resolve(PROP_WAL_TABLE_NAME, ENV_WAL_TABLE_NAME).orElse(tableName + WAL_TABLE_SUFFIX);
            }
            if (indexKeys == null) {
                indexKeys = splitKeys(require(PROP_INDEX_KEYS, ENV_INDEX_KEYS));
            }
            if (primaryField == null) {
                primaryField = require(PROP_ROW_KEY, ENV_ROW_KEY);
            }
            if (replayPolicy == null) {
                replayPolicy = resolveReplayPolicy();
            }
            if (recoveryInterval == null) {
                recoveryInterval = Duration.ofSeconds(resolveSeconds());
            }

            return new CatalogConfig(this);
        }

        private String require(String sysProp, String envVar) throws ConfigurationException {
            return resolve(sysProp, envVar).orElseThrow(() -> new ConfigurationException(
                ErrorCode.MISSING_CONFIGURATION,
                "Required setting '" + sysProp + "' (environment variable '" + envVar + "') is not set"));
        }

        private Optional<String> resolve(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }

            return Optional.empty();
        }

        private ReplayPolicy resolveReplayPolicy() throws ConfigurationException {
            Optional<String> value = resolve(PROP_REPLAY_POLICY, ENV_REPLAY_POLICY);
            if (value.isEmpty()) {
                return DEFAULT_REPLAY_POLICY;
            }
            try {
                return ReplayPolicy.valueOf(value.get().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ErrorCode.MISSING_CONFIGURATION,
                    "Unknown replay policy '" + value.get() + "', expected one of " + Arrays.toString(ReplayPolicy.values()));
            }
        }

        private long resolveSeconds() throws ConfigurationException {
            Optional<String> value = resolve(PROP_RECOVERY_INTERVAL, ENV_RECOVERY_INTERVAL);
            if (value.isEmpty()) {
                return DEFAULT_RECOVERY_INTERVAL_SECONDS;
            }
            long seconds;
            try {
                seconds = Long.parseLong(value.get());
            } catch (NumberFormatException e) {
                throw invalidInterval(value.get());
            }
            if (seconds <= 0) {
                throw invalidInterval(value.get());
            }
            return seconds;
        }

        private static ConfigurationException invalidInterval(String value) {
            return new ConfigurationException(ErrorCode.MISSING_CONFIGURATION,
                "Recovery interval must be a positive number of seconds, got '" + value + "'");
        }

        private static List<String> splitKeys(String commaSeparated) {
            return Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
        }
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = CatalogConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
                return props;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_FILE + " from classpath", e);
        }

        // Try working directory
        Path localFile = Path.of(PROPERTIES_FILE);
        if (Files.exists(localFile)) {
            try (InputStream is = Files.newInputStream(localFile)) {
                props.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + localFile.toAbsolutePath(), e);
            }
        }

        return props;
    }
}

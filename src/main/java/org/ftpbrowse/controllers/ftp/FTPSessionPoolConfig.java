package org.ftpbrowse.controllers.ftp;

import org.apache.nifi.controller.ConfigurationContext;

import java.util.concurrent.TimeUnit;

/**
 * Configuration of an {@link FTPSessionPoolManager} and the sessions it opens.
 * This class is immutable, and instances are created using the Builder pattern.
 */
public class FTPSessionPoolConfig {
    // Default values
    public static final int DEFAULT_CAPACITY = 3;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 120000; // 2 minutes
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 5000; // 5 seconds
    public static final int DEFAULT_STAT_CACHE_SIZE = 20000;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 30000;
    public static final int DEFAULT_DATA_TIMEOUT_MS = 60000;
    public static final String DEFAULT_CONTROL_ENCODING = "UTF-8";

    // Pool parameters
    private final int capacity;
    private final long idleTimeoutMillis;
    private final long healthCheckIntervalMillis;
    private final int statCacheSize;

    // Session parameters
    private final int connectionTimeoutMillis;
    private final int dataTimeoutMillis;
    private final String controlEncoding;
    private final boolean activeMode;
    private final boolean validateServerCertificate;

    private FTPSessionPoolConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.idleTimeoutMillis = builder.idleTimeoutMillis;
        this.healthCheckIntervalMillis = builder.healthCheckIntervalMillis;
        this.statCacheSize = builder.statCacheSize;
        this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
        this.dataTimeoutMillis = builder.dataTimeoutMillis;
        this.controlEncoding = builder.controlEncoding;
        this.activeMode = builder.activeMode;
        this.validateServerCertificate = builder.validateServerCertificate;
    }

    /**
     * Creates a new FTPSessionPoolConfig from a NiFi ConfigurationContext.
     *
     * @param context the NiFi ConfigurationContext
     * @return a new FTPSessionPoolConfig
     */
    public static FTPSessionPoolConfig fromContext(final ConfigurationContext context) {
        Builder builder = builder();

        builder.capacity(context.getProperty(PersistentFTPSessionPoolService.POOL_CAPACITY)
                .evaluateAttributeExpressions().asInteger());
        builder.idleTimeoutMillis(context.getProperty(PersistentFTPSessionPoolService.CONNECTION_IDLE_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS));
        builder.healthCheckIntervalMillis(context.getProperty(PersistentFTPSessionPoolService.HEALTH_CHECK_INTERVAL)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS));
        builder.statCacheSize(context.getProperty(PersistentFTPSessionPoolService.STAT_CACHE_SIZE)
                .evaluateAttributeExpressions().asInteger());

        builder.connectionTimeoutMillis(context.getProperty(PersistentFTPSessionPoolService.CONNECTION_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());
        builder.dataTimeoutMillis(context.getProperty(PersistentFTPSessionPoolService.DATA_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());
        builder.controlEncoding(context.getProperty(PersistentFTPSessionPoolService.CONTROL_ENCODING)
                .evaluateAttributeExpressions().getValue());

        // Connection mode
        builder.activeMode(context.getProperty(PersistentFTPSessionPoolService.ACTIVE_MODE).asBoolean());
        builder.validateServerCertificate(
                context.getProperty(PersistentFTPSessionPoolService.VALIDATE_SERVER_CERTIFICATE).asBoolean());

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the maximum number of pooled control connections
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * @return how long an entry may stay unused before it is evicted
     */
    public long getIdleTimeoutMillis() {
        return idleTimeoutMillis;
    }

    /**
     * @return the minimum time between two NOOP checks of the same entry
     */
    public long getHealthCheckIntervalMillis() {
        return healthCheckIntervalMillis;
    }

    public int getStatCacheSize() {
        return statCacheSize;
    }

    public int getConnectionTimeoutMillis() {
        return connectionTimeoutMillis;
    }

    public int getDataTimeoutMillis() {
        return dataTimeoutMillis;
    }

    public String getControlEncoding() {
        return controlEncoding;
    }

    public boolean isActiveMode() {
        return activeMode;
    }

    public boolean isValidateServerCertificate() {
        return validateServerCertificate;
    }

    @Override
    public String toString() {
        return "FTPSessionPoolConfig{" +
                "capacity=" + capacity +
                ", idleTimeoutMillis=" + idleTimeoutMillis +
                ", healthCheckIntervalMillis=" + healthCheckIntervalMillis +
                ", statCacheSize=" + statCacheSize +
                ", connectionTimeoutMillis=" + connectionTimeoutMillis +
                ", dataTimeoutMillis=" + dataTimeoutMillis +
                ", controlEncoding='" + controlEncoding + '\'' +
                ", activeMode=" + activeMode +
                ", validateServerCertificate=" + validateServerCertificate +
                '}';
    }

    /**
     * Builder for FTPSessionPoolConfig.
     */
    public static class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private long idleTimeoutMillis = DEFAULT_IDLE_TIMEOUT_MS;
        private long healthCheckIntervalMillis = DEFAULT_HEALTH_CHECK_INTERVAL_MS;
        private int statCacheSize = DEFAULT_STAT_CACHE_SIZE;
        private int connectionTimeoutMillis = DEFAULT_CONNECTION_TIMEOUT_MS;
        private int dataTimeoutMillis = DEFAULT_DATA_TIMEOUT_MS;
        private String controlEncoding = DEFAULT_CONTROL_ENCODING;
        private boolean activeMode = false;
        private boolean validateServerCertificate = true;

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder idleTimeoutMillis(long idleTimeoutMillis) {
            this.idleTimeoutMillis = idleTimeoutMillis;
            return this;
        }

        public Builder healthCheckIntervalMillis(long healthCheckIntervalMillis) {
            this.healthCheckIntervalMillis = healthCheckIntervalMillis;
            return this;
        }

        public Builder statCacheSize(int statCacheSize) {
            this.statCacheSize = statCacheSize;
            return this;
        }

        public Builder connectionTimeoutMillis(int connectionTimeoutMillis) {
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder dataTimeoutMillis(int dataTimeoutMillis) {
            this.dataTimeoutMillis = dataTimeoutMillis;
            return this;
        }

        public Builder controlEncoding(String controlEncoding) {
            this.controlEncoding = controlEncoding;
            return this;
        }

        public Builder activeMode(boolean activeMode) {
            this.activeMode = activeMode;
            return this;
        }

        public Builder validateServerCertificate(boolean validateServerCertificate) {
            this.validateServerCertificate = validateServerCertificate;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public FTPSessionPoolConfig build() {
            if (capacity < 1) {
                throw new IllegalArgumentException("Pool capacity must be at least 1: " + capacity);
            }
            if (idleTimeoutMillis < 0 || healthCheckIntervalMillis < 0) {
                throw new IllegalArgumentException("Idle timeout and health check interval must not be negative");
            }
            if (statCacheSize < 1) {
                throw new IllegalArgumentException("Stat cache size must be positive: " + statCacheSize);
            }
            if (controlEncoding == null || controlEncoding.isEmpty()) {
                controlEncoding = DEFAULT_CONTROL_ENCODING;
            }
            return new FTPSessionPoolConfig(this);
        }
    }
}

package org.ftpbrowse.controllers.ftp;

import org.apache.nifi.annotation.behavior.DynamicProperty;
import org.apache.nifi.annotation.documentation.CapabilityDescription;
import org.apache.nifi.annotation.documentation.Tags;
import org.apache.nifi.annotation.lifecycle.OnDisabled;
import org.apache.nifi.annotation.lifecycle.OnEnabled;
import org.apache.nifi.components.PropertyDescriptor;
import org.apache.nifi.components.ValidationContext;
import org.apache.nifi.components.ValidationResult;
import org.apache.nifi.controller.AbstractControllerService;
import org.apache.nifi.controller.ConfigurationContext;
import org.apache.nifi.expression.ExpressionLanguageScope;
import org.apache.nifi.processor.util.StandardValidators;
import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;
import org.ftpbrowse.services.FTPSessionPoolService;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Controller service exposing a {@link FTPSessionPoolManager}. Every dynamic property defines a
 * bookmark: its name is the alias (for example {@code ftp://archive}) and its value the URL the
 * alias stands for.
 */
@Tags({"ftp", "ftps", "connection", "pool", "session", "persistent"})
@CapabilityDescription("Pools FTP and FTPS control sessions per calling thread and server, health-checks them with NOOP "
        + "and evicts idle or excess sessions. Dynamic properties define bookmark aliases.")
@DynamicProperty(name = "Bookmark alias URL", value = "Target URL",
        description = "Resolves URLs starting with the alias against the target URL, whose path becomes the default path",
        expressionLanguageScope = ExpressionLanguageScope.VARIABLE_REGISTRY)
public class PersistentFTPSessionPoolService extends AbstractControllerService implements FTPSessionPoolService {

    // Pool property descriptors
    public static final PropertyDescriptor POOL_CAPACITY = new PropertyDescriptor.Builder()
            .name("Pool Capacity")
            .description("The maximum number of pooled control sessions across all threads and servers; "
                    + "the least recently used sessions are closed first")
            .required(true)
            .defaultValue("3")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.POSITIVE_INTEGER_VALIDATOR)
            .build();

    public static final PropertyDescriptor CONNECTION_IDLE_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Connection Idle Timeout")
            .description("The amount of time a pooled session may stay unused before it is closed")
            .required(true)
            .defaultValue("120 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor HEALTH_CHECK_INTERVAL = new PropertyDescriptor.Builder()
            .name("Health Check Interval")
            .description("The minimum time between two NOOP checks of the same pooled session")
            .required(true)
            .defaultValue("5 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor STAT_CACHE_SIZE = new PropertyDescriptor.Builder()
            .name("Stat Cache Size")
            .description("The number of remote file entries each session caches")
            .required(true)
            .defaultValue("20000")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.POSITIVE_INTEGER_VALIDATOR)
            .build();

    // Connection timeout properties
    public static final PropertyDescriptor CONNECTION_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Connection Timeout")
            .description("The amount of time to wait before timing out while creating a connection")
            .required(true)
            .defaultValue("30 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor DATA_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Data Timeout")
            .description("The amount of time to wait before timing out while transferring data")
            .required(true)
            .defaultValue("60 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor CONTROL_ENCODING = new PropertyDescriptor.Builder()
            .name("Control Encoding")
            .description("The character encoding to use for the control channel")
            .required(true)
            .defaultValue("UTF-8")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.CHARACTER_SET_VALIDATOR)
            .build();

    // Connection mode properties
    public static final PropertyDescriptor ACTIVE_MODE = new PropertyDescriptor.Builder()
            .name("Active Mode")
            .description("Whether to use active mode instead of passive mode for data connections")
            .required(true)
            .allowableValues("true", "false")
            .defaultValue("false")
            .build();

    public static final PropertyDescriptor VALIDATE_SERVER_CERTIFICATE = new PropertyDescriptor.Builder()
            .name("Validate Server Certificate")
            .description("Whether to validate the certificate presented by FTPS servers")
            .required(true)
            .allowableValues("true", "false")
            .defaultValue("true")
            .build();

    private static final List<PropertyDescriptor> properties;

    static {
        final List<PropertyDescriptor> props = new ArrayList<>();

        // Pool properties
        props.add(POOL_CAPACITY);
        props.add(CONNECTION_IDLE_TIMEOUT);
        props.add(HEALTH_CHECK_INTERVAL);
        props.add(STAT_CACHE_SIZE);

        // Session properties
        props.add(CONNECTION_TIMEOUT);
        props.add(DATA_TIMEOUT);
        props.add(CONTROL_ENCODING);
        props.add(ACTIVE_MODE);
        props.add(VALIDATE_SERVER_CERTIFICATE);

        properties = Collections.unmodifiableList(props);
    }

    private volatile FTPSessionPoolConfig config;
    private volatile FTPSessionPoolManager pool;

    @Override
    protected List<PropertyDescriptor> getSupportedPropertyDescriptors() {
        return properties;
    }

    @Override
    protected PropertyDescriptor getSupportedDynamicPropertyDescriptor(final String propertyDescriptorName) {
        return new PropertyDescriptor.Builder()
                .name(propertyDescriptorName)
                .description("Bookmark target URL for the alias " + propertyDescriptorName)
                .required(false)
                .dynamic(true)
                .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
                .addValidator(StandardValidators.URI_VALIDATOR)
                .build();
    }

    @Override
    protected Collection<ValidationResult> customValidate(ValidationContext validationContext) {
        final List<ValidationResult> results = new ArrayList<>();

        // Validate connection idle timeout is greater than health check interval
        if (validationContext.getProperty(CONNECTION_IDLE_TIMEOUT).isSet()
                && validationContext.getProperty(HEALTH_CHECK_INTERVAL).isSet()) {

            final long idleTimeout = validationContext.getProperty(CONNECTION_IDLE_TIMEOUT)
                    .evaluateAttributeExpressions()
                    .asTimePeriod(TimeUnit.MILLISECONDS);

            final long healthCheckInterval = validationContext.getProperty(HEALTH_CHECK_INTERVAL)
                    .evaluateAttributeExpressions()
                    .asTimePeriod(TimeUnit.MILLISECONDS);

            if (idleTimeout <= healthCheckInterval) {
                results.add(new ValidationResult.Builder()
                        .subject("Connection Timeout Configuration")
                        .valid(false)
                        .explanation("Connection Idle Timeout must be greater than Health Check Interval")
                        .build());
            }
        }

        // Validate bookmark aliases
        for (final PropertyDescriptor descriptor : validationContext.getProperties().keySet()) {
            if (!descriptor.isDynamic()) {
                continue;
            }
            try {
                FTPIdentityResolver.stripPath(descriptor.getName());
            } catch (IllegalArgumentException e) {
                results.add(new ValidationResult.Builder()
                        .subject(descriptor.getName())
                        .valid(false)
                        .explanation("Bookmark alias is not a valid URL: " + e.getMessage())
                        .build());
            }
        }

        return results;
    }

    @OnEnabled
    public void onEnabled(final ConfigurationContext context) {
        this.config = FTPSessionPoolConfig.fromContext(context);
        final InMemoryFTPBookmarkStore bookmarks = loadBookmarks(context);

        final FTPConnectionManager connectionManager = new FTPConnectionManager(config, getLogger());
        this.pool = new FTPSessionPoolManager(config, connectionManager, bookmarks, getLogger());

        getLogger().info("Initialized FTP Session Pool Service with {} bookmarks: {}",
                new Object[] { bookmarks.getBookmarks().size(), config });
    }

    InMemoryFTPBookmarkStore loadBookmarks(final ConfigurationContext context) {
        final Map<String, FTPBookmark> bookmarks = new HashMap<>();
        for (final Map.Entry<PropertyDescriptor, String> entry : context.getProperties().entrySet()) {
            final PropertyDescriptor descriptor = entry.getKey();
            if (!descriptor.isDynamic()) {
                continue;
            }
            final String target = context.getProperty(descriptor).evaluateAttributeExpressions().getValue();
            if (target == null || target.isEmpty()) {
                continue;
            }
            bookmarks.put(FTPIdentityResolver.stripPath(descriptor.getName()), FTPBookmark.fromUrl(target));
            getLogger().debug("Loaded bookmark {}", descriptor.getName());
        }
        return new InMemoryFTPBookmarkStore(bookmarks);
    }

    @OnDisabled
    public void onDisabled() {
        if (this.pool != null) {
            try {
                this.pool.closeAll();
                getLogger().info("Successfully shutdown FTP Session Pool Service");
            } catch (RuntimeException e) {
                getLogger().error("Error shutting down FTP Session Pool Service", e);
            }
        }

        this.pool = null;
        this.config = null;
    }

    @Override
    public FTPSessionHandle acquire(String url) throws FTPConnectionException {
        return getPool().acquire(url);
    }

    @Override
    public void closeAll() {
        getPool().closeAll();
    }

    @Override
    public void closeByBaseUrl(String baseUrl) {
        getPool().closeByBaseUrl(baseUrl);
    }

    @Override
    public List<FTPOpenConnection> listOpenConnections() {
        return getPool().listOpenConnections();
    }

    @Override
    public void recordVisited(String url) {
        getPool().recordVisited(url);
    }

    @Override
    public Map<String, Object> getPoolMetrics() {
        final FTPSessionPoolManager current = this.pool;
        if (current == null) {
            final Map<String, Object> stats = new HashMap<>();
            stats.put("status", "Not initialized");
            return stats;
        }
        return current.getPoolMetrics();
    }

    /**
     * @return the configuration the service was enabled with, or null while disabled
     */
    public FTPSessionPoolConfig getConfig() {
        return config;
    }

    private FTPSessionPoolManager getPool() {
        final FTPSessionPoolManager current = this.pool;
        if (current == null) {
            throw new IllegalStateException("FTP Session Pool Service is not enabled");
        }
        return current;
    }
}

package org.ftpbrowse.controllers.ftp;

import org.apache.nifi.logging.ComponentLog;
import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of FTP control sessions keyed by caller context, host, port, user and password.
 * <p>
 * Every acquire first evicts sessions idle longer than the idle timeout, then trims the pool to its
 * capacity by evicting the least recently used sessions. A pooled session is health-checked with NOOP
 * at most once per health-check interval and is silently replaced when it turns out to be dead.
 * <p>
 * All bookkeeping, including connecting and health-checking, happens under a single lock. Reaping the
 * finished children of a released session does not take the lock.
 */
public class FTPSessionPoolManager implements FTPSessionPool {
    private final FTPSessionPoolConfig config;
    private final FTPSessionFactory sessionFactory;
    private final FTPIdentityResolver identityResolver;
    private final FTPCallerContext callerContext;
    private final Clock clock;
    private final ComponentLog logger;

    private final ReentrantLock lock = new ReentrantLock();
    // insertion order breaks lastUsedAt ties during capacity eviction
    private final Map<FTPPoolKey, FTPConnectionEntry> entries = new LinkedHashMap<>();
    private final FTPSessionRegistry registry = new FTPSessionRegistry();

    // Metrics
    private final AtomicLong createdSessions = new AtomicLong(0);
    private final AtomicLong reusedSessions = new AtomicLong(0);
    private final AtomicLong healthChecks = new AtomicLong(0);
    private final AtomicLong failedHealthChecks = new AtomicLong(0);
    private final Map<FTPEvictionReason, AtomicLong> evictions = new EnumMap<>(FTPEvictionReason.class);

    /**
     * Creates a pool keyed on the calling thread and driven by the system clock.
     *
     * @param config the pool configuration
     * @param sessionFactory opens new sessions
     * @param bookmarks the bookmark aliases consulted when resolving URLs
     * @param logger the logger to use
     */
    public FTPSessionPoolManager(FTPSessionPoolConfig config, FTPSessionFactory sessionFactory,
            FTPBookmarkStore bookmarks, ComponentLog logger) {
        this(config, sessionFactory, bookmarks, FTPCallerContext.CURRENT_THREAD, Clock.systemUTC(), logger);
    }

    public FTPSessionPoolManager(FTPSessionPoolConfig config, FTPSessionFactory sessionFactory,
            FTPBookmarkStore bookmarks, FTPCallerContext callerContext, Clock clock, ComponentLog logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.identityResolver = new FTPIdentityResolver(bookmarks);
        this.callerContext = Objects.requireNonNull(callerContext, "callerContext");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = logger;

        for (FTPEvictionReason reason : FTPEvictionReason.values()) {
            evictions.put(reason, new AtomicLong(0));
        }

        logger.info("Created FTP session pool with capacity: {}, idle timeout: {} ms, health check interval: {} ms",
                new Object[] { config.getCapacity(), config.getIdleTimeoutMillis(), config.getHealthCheckIntervalMillis() });
    }

    @Override
    public FTPSessionHandle acquire(String url) throws FTPConnectionException {
        return acquire(url, callerContext.currentToken());
    }

    @Override
    public FTPSessionHandle acquire(String url, Object callerToken) throws FTPConnectionException {
        return acquire(identityResolver.resolve(url), callerToken);
    }

    @Override
    public FTPSessionHandle acquire(FTPConnectionIdentity identity, Object callerToken) throws FTPConnectionException {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(callerToken, "callerToken");

        lock.lock();
        try {
            Instant now = clock.instant();
            evictIdleEntries(now);
            enforceCapacity();

            FTPPoolKey key = FTPPoolKey.of(callerToken, identity);
            FTPConnectionEntry entry = entries.get(key);
            if (entry != null && !reuse(entry, identity, now)) {
                entry = null;
            }
            if (entry == null) {
                entry = createEntry(key, identity, now);
            }
            return new FTPSessionHandle(this, entry, identity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decides whether a pooled entry can be handed out again, evicting it if not.
     *
     * @return true if the entry is reusable; its timestamps have been refreshed
     */
    private boolean reuse(FTPConnectionEntry entry, FTPConnectionIdentity requested, Instant now) {
        FTPSession session = entry.getSession();
        if (session.isClosed()) {
            logger.debug("Session {} for {} was closed, reconnecting", new Object[] { session.getId(), entry.getBaseUrl() });
            evict(entry, FTPEvictionReason.SESSION_CLOSED);
            return false;
        }

        long sinceHealthCheck = Duration.between(entry.getLastHealthCheckAt(), now).toMillis();
        if (sinceHealthCheck > config.getHealthCheckIntervalMillis()) {
            healthChecks.incrementAndGet();
            boolean alive;
            try {
                alive = session.sendNoOp();
            } catch (IOException e) {
                logger.debug("NOOP failed on session {}: {}", new Object[] { session.getId(), e.getMessage() });
                alive = false;
            }

            if (!alive) {
                failedHealthChecks.incrementAndGet();
                logger.debug("Session {} for {} failed its health check, reconnecting",
                        new Object[] { session.getId(), entry.getBaseUrl() });
                evict(entry, FTPEvictionReason.HEALTH_CHECK_FAILED);
                return false;
            }
            entry.markAsTested(now);
        } else {
            entry.markAsUsed(now);
        }

        FTPScheme sessionScheme = session.getIdentity().getScheme();
        if (sessionScheme != requested.getScheme()) {
            logger.debug("Reusing {} session {} for a {} request to {}",
                    new Object[] { sessionScheme, session.getId(), requested.getScheme(), entry.getBaseUrl() });
        }

        reusedSessions.incrementAndGet();
        logger.debug("Reusing {}", entry);
        return true;
    }

    private FTPConnectionEntry createEntry(FTPPoolKey key, FTPConnectionIdentity identity, Instant now)
            throws FTPConnectionException {
        FTPSession session = sessionFactory.openSession(identity);
        session.getStatCache().resize(config.getStatCacheSize());

        FTPConnectionEntry entry = new FTPConnectionEntry(key, session, identity.getBaseUrl(), now, logger);
        entries.put(key, entry);
        createdSessions.incrementAndGet();
        logger.debug("Created {}", entry);

        enforceCapacity();
        return entry;
    }

    private void evictIdleEntries(Instant now) {
        List<FTPConnectionEntry> idle = new ArrayList<>();
        for (FTPConnectionEntry entry : entries.values()) {
            if (Duration.between(entry.getLastUsedAt(), now).toMillis() > config.getIdleTimeoutMillis()) {
                idle.add(entry);
            }
        }
        for (FTPConnectionEntry entry : idle) {
            evict(entry, FTPEvictionReason.IDLE_TIMEOUT);
        }
    }

    private void enforceCapacity() {
        int excess = entries.size() - config.getCapacity();
        if (excess <= 0) {
            return;
        }

        // List.sort is stable, so equal timestamps keep insertion order
        List<FTPConnectionEntry> byLastUse = new ArrayList<>(entries.values());
        byLastUse.sort(Comparator.comparing(FTPConnectionEntry::getLastUsedAt));
        for (FTPConnectionEntry entry : byLastUse.subList(0, excess)) {
            evict(entry, FTPEvictionReason.CAPACITY);
        }
    }

    private void evict(FTPConnectionEntry entry, FTPEvictionReason reason) {
        entries.remove(entry.getKey());
        if (entry.evict(reason)) {
            evictions.get(reason).incrementAndGet();
        }
    }

    @Override
    public void release(FTPSessionHandle handle) {
        if (handle == null) {
            return;
        }
        if (handle.getPool() != this) {
            throw new IllegalArgumentException("Session handle does not belong to this pool");
        }
        if (!handle.markReleased()) {
            return;
        }

        FTPSession session = handle.getEntry().getSession();
        int reaped = session.reapFinishedChildren();
        if (reaped > 0) {
            logger.debug("Reaped {} finished child sessions of session {}", new Object[] { reaped, session.getId() });
        }
    }

    @Override
    public void closeAll() {
        lock.lock();
        try {
            int count = entries.size();
            for (FTPConnectionEntry entry : new ArrayList<>(entries.values())) {
                evict(entry, FTPEvictionReason.CLOSE_ALL);
            }
            registry.clear();
            logger.info("Closed all {} pooled FTP sessions", count);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void closeByBaseUrl(String baseUrl) {
        lock.lock();
        try {
            int closed = 0;
            for (FTPConnectionEntry entry : new ArrayList<>(entries.values())) {
                if (entry.getBaseUrl().equals(baseUrl)) {
                    evict(entry, FTPEvictionReason.CLOSED_BY_BASE_URL);
                    closed++;
                }
            }
            registry.remove(baseUrl);
            if (closed > 0) {
                logger.info("Closed {} pooled FTP sessions for {}", new Object[] { closed, baseUrl });
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FTPOpenConnection> listOpenConnections() {
        lock.lock();
        try {
            TreeSet<String> baseUrls = new TreeSet<>();
            for (FTPConnectionEntry entry : entries.values()) {
                baseUrls.add(entry.getBaseUrl());
            }

            List<FTPOpenConnection> open = new ArrayList<>(baseUrls.size());
            for (String baseUrl : baseUrls) {
                open.add(new FTPOpenConnection(baseUrl, registry.getLastVisited(baseUrl)));
            }
            return open;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordVisited(String url) {
        String baseUrl = identityResolver.resolve(url).getBaseUrl();
        lock.lock();
        try {
            registry.recordVisited(baseUrl, url);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Object> getPoolMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();

        lock.lock();
        try {
            metrics.put("size", entries.size());
            metrics.put("trackedLocations", registry.size());
        } finally {
            lock.unlock();
        }
        metrics.put("capacity", config.getCapacity());

        // Usage metrics
        metrics.put("createdSessions", createdSessions.get());
        metrics.put("reusedSessions", reusedSessions.get());
        metrics.put("healthChecks", healthChecks.get());
        metrics.put("failedHealthChecks", failedHealthChecks.get());

        for (Map.Entry<FTPEvictionReason, AtomicLong> eviction : evictions.entrySet()) {
            metrics.put("evicted." + eviction.getKey().name(), eviction.getValue().get());
        }
        return metrics;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the pooled entry for the key, or null; for inspection only
     */
    FTPConnectionEntry getEntry(FTPPoolKey key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public FTPSessionPoolConfig getConfig() {
        return config;
    }
}

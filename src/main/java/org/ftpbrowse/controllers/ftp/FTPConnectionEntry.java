package org.ftpbrowse.controllers.ftp;

import org.apache.nifi.logging.ComponentLog;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One pooled control session together with its bookkeeping: timestamps, base URL label and state.
 * Timestamps are only mutated by {@link FTPSessionPoolManager} while it holds its lock.
 */
public class FTPConnectionEntry {
    private final FTPPoolKey key;
    private final FTPSession session;
    private final String baseUrl;
    private final ComponentLog logger;
    private final AtomicReference<FTPConnectionState> state;

    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private volatile Instant lastHealthCheckAt;

    /**
     * Creates an entry for a freshly opened session. All timestamps start at {@code now}.
     *
     * @param key the pool key the entry is stored under
     * @param session the live session
     * @param baseUrl the base URL label of the session's server, without password or path
     * @param now the current time
     * @param logger the logger to use
     */
    public FTPConnectionEntry(FTPPoolKey key, FTPSession session, String baseUrl, Instant now, ComponentLog logger) {
        this.key = key;
        this.session = session;
        this.baseUrl = baseUrl;
        this.logger = logger;
        this.state = new AtomicReference<>(FTPConnectionState.UNVALIDATED);
        this.createdAt = now;
        this.lastUsedAt = now;
        this.lastHealthCheckAt = now;
    }

    public FTPPoolKey getKey() {
        return key;
    }

    public FTPSession getSession() {
        return session;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public FTPConnectionState getState() {
        return state.get();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public Instant getLastHealthCheckAt() {
        return lastHealthCheckAt;
    }

    /**
     * Records a reuse that skipped the health check.
     *
     * @param now the current time
     */
    void markAsUsed(Instant now) {
        this.lastUsedAt = now;
        state.compareAndSet(FTPConnectionState.VALIDATED, FTPConnectionState.UNVALIDATED);
    }

    /**
     * Records a reuse preceded by a successful health check.
     *
     * @param now the current time
     */
    void markAsTested(Instant now) {
        this.lastHealthCheckAt = now;
        this.lastUsedAt = now;
        state.compareAndSet(FTPConnectionState.UNVALIDATED, FTPConnectionState.VALIDATED);
    }

    /**
     * Closes children and session and moves the entry to EVICTED. Errors are logged, never thrown;
     * a second call does nothing.
     *
     * @param reason why the entry is evicted
     * @return true if this call performed the eviction
     */
    boolean evict(FTPEvictionReason reason) {
        FTPConnectionState previous = state.getAndSet(FTPConnectionState.EVICTED);
        if (previous == FTPConnectionState.EVICTED) {
            return false;
        }

        try {
            session.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing session {} during eviction: {}", new Object[] { session.getId(), e.getMessage() });
        }
        logger.debug("Evicted {} ({})", new Object[] { getSummary(), reason });
        return true;
    }

    /**
     * Gets a summary of the entry for logging purposes.
     *
     * @return a summary string
     */
    public String getSummary() {
        return String.format("FTPConnectionEntry[session=%s, baseUrl=%s, caller=%s, state=%s, createdAt=%s, lastUsedAt=%s]",
                session.getId(), baseUrl, key.getCallerToken(), state.get(), createdAt, lastUsedAt);
    }

    @Override
    public String toString() {
        return getSummary();
    }
}

package org.ftpbrowse.controllers.ftp;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller's lease on a pooled session. Closing the handle releases it back to the pool, so
 * try-with-resources releases on every exit path. Once released, the handle refuses further use.
 */
public class FTPSessionHandle implements AutoCloseable {
    private final FTPSessionPool pool;
    private final FTPConnectionEntry entry;
    private final FTPConnectionIdentity identity;
    private final AtomicBoolean released = new AtomicBoolean(false);

    FTPSessionHandle(FTPSessionPool pool, FTPConnectionEntry entry, FTPConnectionIdentity identity) {
        this.pool = pool;
        this.entry = entry;
        this.identity = identity;
    }

    /**
     * @return the live session
     * @throws IllegalStateException if the handle has been released
     */
    public FTPSession getSession() {
        checkNotReleased();
        return entry.getSession();
    }

    /**
     * @return the residual path of the URL the handle was acquired for
     */
    public String getPath() {
        return identity.getPath();
    }

    public FTPConnectionIdentity getIdentity() {
        return identity;
    }

    public String getBaseUrl() {
        return entry.getBaseUrl();
    }

    public boolean isReleased() {
        return released.get();
    }

    FTPSessionPool getPool() {
        return pool;
    }

    FTPConnectionEntry getEntry() {
        return entry;
    }

    /**
     * @return true on the first call only
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    private void checkNotReleased() {
        if (released.get()) {
            throw new IllegalStateException("Session handle for " + entry.getBaseUrl() + " has already been released");
        }
    }

    @Override
    public void close() {
        pool.release(this);
    }

    @Override
    public String toString() {
        return "FTPSessionHandle[" + entry.getBaseUrl() + identity.getPath() + (released.get() ? ", released" : "") + "]";
    }
}

package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPFile;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-recently-used cache of directory entry metadata, keyed by absolute remote path.
 * Listings populate it so that stat calls on the listed entries need no round trip.
 */
public class FTPStatCache {
    public static final int DEFAULT_MAX_SIZE = 5000;

    private int maxSize;
    private final LinkedHashMap<String, FTPFile> entries;

    public FTPStatCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public FTPStatCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Stat cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<String, FTPFile>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, FTPFile> eldest) {
                return size() > FTPStatCache.this.maxSize;
            }
        };
    }

    public synchronized FTPFile get(String path) {
        return entries.get(path);
    }

    public synchronized void put(String path, FTPFile file) {
        entries.put(path, file);
    }

    /**
     * Drops the entry for a path along with every cached entry below it.
     *
     * @param path the absolute remote path
     */
    public synchronized void invalidate(String path) {
        entries.remove(path);
        String prefix = path.endsWith("/") ? path : path + "/";
        Iterator<String> it = entries.keySet().iterator();
        while (it.hasNext()) {
            if (it.next().startsWith(prefix)) {
                it.remove();
            }
        }
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Changes the capacity. Shrinking discards the least recently used entries.
     *
     * @param newMaxSize the new capacity
     */
    public synchronized void resize(int newMaxSize) {
        if (newMaxSize < 1) {
            throw new IllegalArgumentException("Stat cache size must be positive: " + newMaxSize);
        }
        this.maxSize = newMaxSize;
        Iterator<String> it = entries.keySet().iterator();
        while (entries.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int getMaxSize() {
        return maxSize;
    }
}

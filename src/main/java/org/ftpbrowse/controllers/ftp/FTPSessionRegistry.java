package org.ftpbrowse.controllers.ftp;

import java.util.HashMap;
import java.util.Map;

/**
 * Remembers the last URL visited on each server, keyed by base URL.
 * Entries outlive the connections they describe. Not thread-safe: the owning
 * pool mutates it under its lock.
 */
class FTPSessionRegistry {
    private final Map<String, String> lastVisited = new HashMap<>();

    void recordVisited(String baseUrl, String url) {
        lastVisited.put(baseUrl, url);
    }

    /**
     * @return the last visited URL, or {@code baseUrl + "/"} if none was recorded
     */
    String getLastVisited(String baseUrl) {
        return lastVisited.getOrDefault(baseUrl, baseUrl + "/");
    }

    void remove(String baseUrl) {
        lastVisited.remove(baseUrl);
    }

    void clear() {
        lastVisited.clear();
    }

    int size() {
        return lastVisited.size();
    }
}

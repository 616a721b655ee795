package org.ftpbrowse.controllers.ftp;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bookmark table held in memory, filled by the host from whatever it persists.
 */
public class InMemoryFTPBookmarkStore implements FTPBookmarkStore {
    private final ConcurrentHashMap<String, FTPBookmark> bookmarks = new ConcurrentHashMap<>();

    public InMemoryFTPBookmarkStore() {
    }

    public InMemoryFTPBookmarkStore(Map<String, FTPBookmark> initial) {
        bookmarks.putAll(initial);
    }

    @Override
    public FTPBookmark getBookmark(String aliasBaseUrl) {
        return aliasBaseUrl == null ? null : bookmarks.get(aliasBaseUrl);
    }

    /**
     * Adds or replaces an alias.
     *
     * @param aliasBaseUrl the alias, a URL without path
     * @param bookmark the target of the alias
     */
    public void put(String aliasBaseUrl, FTPBookmark bookmark) {
        bookmarks.put(aliasBaseUrl, bookmark);
    }

    public Map<String, FTPBookmark> getBookmarks() {
        return Collections.unmodifiableMap(bookmarks);
    }
}

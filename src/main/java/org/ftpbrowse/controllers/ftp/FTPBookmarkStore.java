package org.ftpbrowse.controllers.ftp;

/**
 * Read-only view of the bookmark table consulted when resolving connection identities.
 * Loading and saving bookmarks is left to the host application.
 */
public interface FTPBookmarkStore {

    /**
     * An empty bookmark table.
     */
    FTPBookmarkStore EMPTY = alias -> null;

    /**
     * Looks up an alias.
     *
     * @param aliasBaseUrl a URL without path, exactly as typed by the user
     * @return the bookmark, or null if the URL is not an alias
     */
    FTPBookmark getBookmark(String aliasBaseUrl);
}

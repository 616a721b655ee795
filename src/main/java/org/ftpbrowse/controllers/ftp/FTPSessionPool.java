package org.ftpbrowse.controllers.ftp;

import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;

import java.util.List;
import java.util.Map;

/**
 * Interface for a pool of FTP control sessions keyed by caller context and server identity.
 */
public interface FTPSessionPool {

    /**
     * Acquires a session for the given URL on behalf of the current caller context.
     * The handle must be released, preferably with try-with-resources.
     *
     * @param url an ftp:// or ftps:// URL, possibly a bookmark alias
     * @return a handle on a live session
     * @throws FTPConnectionException if a new session is needed and cannot be established
     * @throws IllegalArgumentException if the URL cannot be parsed
     */
    FTPSessionHandle acquire(String url) throws FTPConnectionException;

    /**
     * Acquires a session for the given URL on behalf of an explicit caller context.
     *
     * @param url an ftp:// or ftps:// URL, possibly a bookmark alias
     * @param callerToken the caller context token
     * @return a handle on a live session
     * @throws FTPConnectionException if a new session is needed and cannot be established
     */
    FTPSessionHandle acquire(String url, Object callerToken) throws FTPConnectionException;

    /**
     * Acquires a session for an already resolved identity.
     *
     * @param identity the resolved server identity
     * @param callerToken the caller context token
     * @return a handle on a live session
     * @throws FTPConnectionException if a new session is needed and cannot be established
     */
    FTPSessionHandle acquire(FTPConnectionIdentity identity, Object callerToken) throws FTPConnectionException;

    /**
     * Releases a handle. Sends nothing on the control connection; finished child sessions are
     * closed and dropped. Releasing twice is a no-op.
     *
     * @param handle the handle to release
     */
    void release(FTPSessionHandle handle);

    /**
     * Closes every pooled session and forgets every recorded location.
     */
    void closeAll();

    /**
     * Closes every pooled session of one server and user and forgets its recorded location.
     * Unknown base URLs are ignored.
     *
     * @param baseUrl a base URL as returned by {@link #listOpenConnections()}
     */
    void closeByBaseUrl(String baseUrl);

    /**
     * Lists the servers that have at least one pooled session, sorted by base URL.
     *
     * @return one entry per distinct base URL
     */
    List<FTPOpenConnection> listOpenConnections();

    /**
     * Records the URL as the last visited location of its server.
     *
     * @param url an ftp:// or ftps:// URL, possibly a bookmark alias
     */
    void recordVisited(String url);

    /**
     * Gets detailed metrics about the pool.
     *
     * @return a map of metrics about the pool
     */
    Map<String, Object> getPoolMetrics();

    /**
     * @return the number of pooled sessions
     */
    int size();
}

package org.ftpbrowse.services;

import org.apache.nifi.controller.ControllerService;
import org.ftpbrowse.controllers.ftp.FTPOpenConnection;
import org.ftpbrowse.controllers.ftp.FTPSessionHandle;
import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;

import java.util.List;
import java.util.Map;

/**
 * Controller service that hands out pooled FTP and FTPS sessions for URLs and
 * remembers where callers last were on each server.
 */
public interface FTPSessionPoolService extends ControllerService {

    /**
     * Acquires a session for the URL on behalf of the calling thread. Close the returned
     * handle to release it.
     *
     * @param url an ftp:// or ftps:// URL, possibly a bookmark alias
     * @return a handle on a live session
     * @throws FTPConnectionException if a new session cannot be established
     * @throws IllegalStateException if the service is not enabled
     */
    FTPSessionHandle acquire(String url) throws FTPConnectionException;

    /**
     * Closes every pooled session and forgets every recorded location.
     */
    void closeAll();

    /**
     * Closes the pooled sessions of one server.
     *
     * @param baseUrl a base URL as listed by {@link #listOpenConnections()}
     */
    void closeByBaseUrl(String baseUrl);

    /**
     * @return the servers with pooled sessions and the last URL visited on each
     */
    List<FTPOpenConnection> listOpenConnections();

    /**
     * Records the URL as the last visited location of its server.
     *
     * @param url an ftp:// or ftps:// URL
     */
    void recordVisited(String url);

    /**
     * Gets statistics about the session pool.
     *
     * @return A map of statistics about the session pool
     */
    Map<String, Object> getPoolMetrics();
}

package org.ftpbrowse.controllers.ftp;

import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;

/**
 * Opens new control sessions for the pool.
 */
public interface FTPSessionFactory {

    /**
     * Connects, authenticates and (for ftps) protects a new session.
     *
     * @param identity the server and credentials; the path is ignored
     * @return the live session
     * @throws FTPConnectionException if the session cannot be established
     */
    FTPSession openSession(FTPConnectionIdentity identity) throws FTPConnectionException;
}

package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPClient;

import java.io.IOException;

/**
 * Opens connected and logged-in Commons Net clients. Sessions use it to spawn
 * child connections for data transfers.
 */
@FunctionalInterface
public interface FTPClientConnector {

    /**
     * @param identity the server and credentials to connect to; the path is ignored
     * @return a connected, authenticated client
     * @throws IOException if the network conversation fails
     * @throws org.ftpbrowse.controllers.ftp.exception.FTPConnectionException if the server rejects the session
     */
    FTPClient connect(FTPConnectionIdentity identity) throws IOException;
}

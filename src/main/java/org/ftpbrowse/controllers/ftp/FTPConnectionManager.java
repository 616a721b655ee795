package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPConnectionClosedException;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.apache.commons.net.util.TrustManagerUtils;
import org.apache.nifi.logging.ComponentLog;
import org.ftpbrowse.controllers.ftp.exception.FTPAuthenticationException;
import org.ftpbrowse.controllers.ftp.exception.FTPConnectionException;
import org.ftpbrowse.controllers.ftp.exception.FTPErrorType;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

/**
 * Creates FTP and explicit FTPS sessions with Apache Commons Net: connect, login and,
 * for ftps, a protected data channel ({@code PBSZ 0}, {@code PROT P}).
 */
public class FTPConnectionManager implements FTPSessionFactory, FTPClientConnector {
    static final String ANONYMOUS_USER = "anonymous";
    static final String ANONYMOUS_PASSWORD = "anonymous@";

    private final FTPSessionPoolConfig config;
    private final ComponentLog logger;

    /**
     * Creates a new FTPConnectionManager with the given configuration and logger.
     *
     * @param config the pool configuration carrying timeouts and transfer settings
     * @param logger the logger to use
     */
    public FTPConnectionManager(FTPSessionPoolConfig config, ComponentLog logger) {
        this.config = config;
        this.logger = logger;
    }

    @Override
    public FTPSession openSession(FTPConnectionIdentity identity) throws FTPConnectionException {
        try {
            FTPClient client = connect(identity);
            FTPSession session = new FTPSession(identity.withPath("/"), client, this, logger);
            logger.debug("Opened session {} to {}", new Object[] { session.getId(), identity.getBaseUrl() });
            return session;
        } catch (FTPConnectionException e) {
            throw e;
        } catch (IOException e) {
            throw new FTPConnectionException(classify(e), identity.getHost(), identity.getPort(),
                    "Failed to establish FTP connection to " + identity.getBaseUrl() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates, connects and authenticates a client for the given identity.
     *
     * @param identity the server and credentials
     * @return a connected, logged-in client
     * @throws IOException if an error occurs while connecting
     * @throws FTPConnectionException if the server refuses the connection, the login or TLS protection
     */
    @Override
    public FTPClient connect(FTPConnectionIdentity identity) throws IOException {
        FTPClient client = createAppropriateClient(identity.getScheme());

        try {
            // Set timeouts and encoding
            client.setConnectTimeout(config.getConnectionTimeoutMillis());
            client.setDataTimeout(config.getDataTimeoutMillis());
            client.setControlEncoding(config.getControlEncoding());

            logger.debug("Connecting to FTP server {}:{}", new Object[] { identity.getHost(), identity.getPort() });
            client.connect(identity.getHost(), identity.getPort());

            // Check reply code to make sure connection was successful
            int reply = client.getReplyCode();
            if (!FTPReply.isPositiveCompletion(reply)) {
                throw new FTPConnectionException(FTPErrorType.CONNECTION_REFUSED, identity.getHost(),
                        identity.getPort(), reply, "FTP server refused connection with code " + reply, null);
            }

            login(client, identity);

            if (identity.getScheme().isSecure()) {
                protect((FTPSClient) client, identity);
            }

            if (config.isActiveMode()) {
                client.enterLocalActiveMode();
            } else {
                client.enterLocalPassiveMode();
            }
            client.setFileType(FTP.BINARY_FILE_TYPE);

            return client;
        } catch (IOException | RuntimeException e) {
            closeClient(client, logger);
            throw e;
        }
    }

    /**
     * Creates the client matching the scheme: a plain client for ftp, an explicit-mode
     * FTPS client for ftps.
     *
     * @param scheme the URL scheme
     * @return an unconnected client
     */
    protected FTPClient createAppropriateClient(FTPScheme scheme) {
        if (!scheme.isSecure()) {
            return new FTPClient();
        }

        FTPSClient ftpsClient = new FTPSClient(false);
        if (!config.isValidateServerCertificate()) {
            logger.warn("Server certificate validation is disabled - this is not recommended for production use");
            ftpsClient.setTrustManager(TrustManagerUtils.getAcceptAllTrustManager());
        }
        return ftpsClient;
    }

    private void login(FTPClient client, FTPConnectionIdentity identity) throws IOException {
        String user = identity.getUser().isEmpty() ? ANONYMOUS_USER : identity.getUser();
        String password = identity.getPassword();
        if (ANONYMOUS_USER.equals(user) && (password.isEmpty() || "-".equals(password))) {
            password = ANONYMOUS_PASSWORD;
        }

        logger.debug("Logging in as user {}", new Object[] { user });
        if (!client.login(user, password)) {
            throw new FTPAuthenticationException(identity.getHost(), identity.getPort(), client.getReplyCode(), user,
                    "Failed to login to FTP server as user " + user);
        }
    }

    private void protect(FTPSClient client, FTPConnectionIdentity identity) throws IOException {
        try {
            client.execPBSZ(0);
            client.execPROT("P");
        } catch (SSLException e) {
            throw new FTPConnectionException(FTPErrorType.TLS_ERROR, identity.getHost(), identity.getPort(),
                    "Failed to protect data channel: " + e.getMessage(), e);
        }
    }

    private static FTPErrorType classify(IOException e) {
        if (e instanceof SocketTimeoutException) {
            return FTPErrorType.CONNECTION_TIMEOUT;
        } else if (e instanceof ConnectException) {
            return FTPErrorType.CONNECTION_REFUSED;
        } else if (e instanceof SSLException) {
            return FTPErrorType.TLS_ERROR;
        } else if (e instanceof FTPConnectionClosedException) {
            return FTPErrorType.CONNECTION_CLOSED;
        }
        // UnknownHostException and everything else
        return FTPErrorType.CONNECTION_ERROR;
    }

    /**
     * Logs out and disconnects a client, ignoring errors.
     *
     * @param client the client to close, may be null
     * @param logger the logger to report errors to
     */
    static void closeClient(FTPClient client, ComponentLog logger) {
        if (client == null) {
            return;
        }

        try {
            if (client.isConnected()) {
                try {
                    client.logout();
                } catch (IOException e) {
                    logger.debug("Error during FTP logout: {}", new Object[] { e.getMessage() });
                }
                try {
                    client.disconnect();
                } catch (IOException e) {
                    logger.debug("Error during FTP disconnect: {}", new Object[] { e.getMessage() });
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Error closing FTP client: {}", new Object[] { e.getMessage() });
        }
    }

    public FTPSessionPoolConfig getConfig() {
        return config;
    }
}

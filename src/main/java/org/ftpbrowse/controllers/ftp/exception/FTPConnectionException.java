package org.ftpbrowse.controllers.ftp.exception;

/**
 * Exception thrown when a fresh FTP session cannot be established
 * (DNS, TCP, negative greeting or TLS negotiation failures).
 */
public class FTPConnectionException extends FTPOperationException {

    private final String host;
    private final int port;

    /**
     * Creates a new FTPConnectionException.
     *
     * @param errorType The type of error that occurred
     * @param message The error message
     */
    public FTPConnectionException(FTPErrorType errorType, String message) {
        this(errorType, null, -1, -1, message, null);
    }

    /**
     * Creates a new FTPConnectionException.
     *
     * @param errorType The type of error that occurred
     * @param host The FTP server hostname
     * @param port The FTP server port
     * @param message The error message
     * @param cause The cause of the exception
     */
    public FTPConnectionException(FTPErrorType errorType, String host, int port, String message, Throwable cause) {
        this(errorType, host, port, -1, message, cause);
    }

    /**
     * Creates a new FTPConnectionException.
     *
     * @param errorType The type of error that occurred
     * @param host The FTP server hostname
     * @param port The FTP server port
     * @param ftpReplyCode The FTP server reply code, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception, may be null
     */
    public FTPConnectionException(FTPErrorType errorType, String host, int port, int ftpReplyCode,
            String message, Throwable cause) {
        super(errorType, null, ftpReplyCode, message, cause);
        this.host = host;
        this.port = port;
    }

    /**
     * Gets the hostname of the FTP server.
     *
     * @return The hostname, or null if not available
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets the port of the FTP server.
     *
     * @return The port, or -1 if not available
     */
    public int getPort() {
        return port;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append("[errorType=").append(getErrorType());

        if (host != null) {
            sb.append(", server=").append(host).append(":").append(port);
        }

        if (getFtpReplyCode() != -1) {
            sb.append(", replyCode=").append(getFtpReplyCode());
        }

        sb.append(", message=").append(getMessage());

        Throwable cause = getCause();
        if (cause != null) {
            sb.append(", cause=").append(cause.getClass().getSimpleName())
              .append(": ").append(cause.getMessage());
        }

        sb.append("]");
        return sb.toString();
    }
}

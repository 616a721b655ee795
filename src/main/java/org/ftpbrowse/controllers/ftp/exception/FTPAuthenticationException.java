package org.ftpbrowse.controllers.ftp.exception;

/**
 * Exception thrown when the FTP server refuses the login of a fresh session.
 */
public class FTPAuthenticationException extends FTPConnectionException {

    private final String username;

    /**
     * Creates a new FTPAuthenticationException.
     *
     * @param host The FTP server hostname
     * @param port The FTP server port
     * @param ftpReplyCode The FTP server reply code
     * @param username The username that was used for authentication
     * @param message The error message
     */
    public FTPAuthenticationException(String host, int port, int ftpReplyCode, String username, String message) {
        super(FTPErrorType.AUTHENTICATION_ERROR, host, port, ftpReplyCode, message, null);
        this.username = username;
    }

    /**
     * Gets the username that was used for authentication.
     *
     * @return The username
     */
    public String getUsername() {
        return username;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append("[errorType=").append(getErrorType());

        if (getFtpReplyCode() != -1) {
            sb.append(", replyCode=").append(getFtpReplyCode());
        }

        sb.append(", username=").append(username);
        sb.append(", message=").append(getMessage());
        sb.append("]");
        return sb.toString();
    }
}

package org.ftpbrowse.controllers.ftp.exception;

/**
 * Enumeration of error types for FTP session pool operations.
 */
public enum FTPErrorType {
    // Connection Errors
    CONNECTION_ERROR(true),
    CONNECTION_TIMEOUT(true),
    CONNECTION_CLOSED(true),
    CONNECTION_REFUSED(true),
    TLS_ERROR(false),

    // Authentication Errors
    AUTHENTICATION_ERROR(false),

    // File Operation Errors
    FILE_NOT_FOUND(false),
    OPERATION_REFUSED(false),

    // Transfer Errors
    TRANSFER_ERROR(true);

    private final boolean recoverable;

    /**
     * Creates a new FTPErrorType.
     *
     * @param recoverable Whether the error is potentially recoverable
     */
    FTPErrorType(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Checks if this error type is potentially recoverable.
     * A recoverable error is one that might succeed if the caller retries.
     *
     * @return true if the error is recoverable, false otherwise
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}

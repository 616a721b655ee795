package org.ftpbrowse.controllers.ftp.exception;

import org.apache.nifi.processor.exception.ProcessException;

/**
 * Base exception class for FTP session pool operations.
 * This is the parent class for all FTP-related exceptions raised by the pool and its sessions.
 */
public class FTPOperationException extends ProcessException {

    private final FTPErrorType errorType;
    private final int ftpReplyCode;
    private final String path;

    /**
     * Creates a new FTPOperationException.
     *
     * @param errorType The type of error that occurred
     * @param message The error message
     */
    public FTPOperationException(FTPErrorType errorType, String message) {
        this(errorType, null, -1, message, null);
    }

    /**
     * Creates a new FTPOperationException.
     *
     * @param errorType The type of error that occurred
     * @param message The error message
     * @param cause The cause of the exception
     */
    public FTPOperationException(FTPErrorType errorType, String message, Throwable cause) {
        this(errorType, null, -1, message, cause);
    }

    /**
     * Creates a new FTPOperationException.
     *
     * @param errorType The type of error that occurred
     * @param ftpReplyCode The FTP server reply code, or -1 if not applicable
     * @param message The error message
     */
    public FTPOperationException(FTPErrorType errorType, int ftpReplyCode, String message) {
        this(errorType, null, ftpReplyCode, message, null);
    }

    /**
     * Creates a new FTPOperationException.
     *
     * @param errorType The type of error that occurred
     * @param path The path of the file or directory involved in the operation
     * @param ftpReplyCode The FTP server reply code, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public FTPOperationException(FTPErrorType errorType, String path, int ftpReplyCode, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.path = path;
        this.ftpReplyCode = ftpReplyCode;
    }

    /**
     * Gets the type of error that occurred.
     *
     * @return The error type
     */
    public FTPErrorType getErrorType() {
        return errorType;
    }

    /**
     * Gets the FTP server reply code.
     *
     * @return The FTP reply code, or -1 if not applicable
     */
    public int getFtpReplyCode() {
        return ftpReplyCode;
    }

    /**
     * Gets the path of the file or directory involved in the operation.
     *
     * @return The path, or null if not applicable
     */
    public String getPath() {
        return path;
    }

    /**
     * Checks if this exception is potentially recoverable by retrying.
     *
     * @return true if the caller may retry, false otherwise
     */
    public boolean isRecoverable() {
        return errorType.isRecoverable();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append("[errorType=").append(errorType);

        if (ftpReplyCode != -1) {
            sb.append(", replyCode=").append(ftpReplyCode);
        }

        if (path != null) {
            sb.append(", path=").append(path);
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

package org.ftpbrowse.controllers.ftp.exception;

/**
 * Exception thrown when the server refuses a file operation issued through a pooled session.
 */
public class FTPFileOperationException extends FTPOperationException {

    private final FileOperation operation;

    /**
     * Enumeration of file operations.
     */
    public enum FileOperation {
        LIST,
        STAT,
        READ,
        WRITE,
        DELETE,
        RENAME,
        MAKE_DIRECTORY,
        REMOVE_DIRECTORY
    }

    /**
     * Creates a new FTPFileOperationException.
     *
     * @param errorType The type of error that occurred
     * @param remotePath The remote file path
     * @param operation The file operation that failed
     * @param ftpReplyCode The FTP server reply code
     * @param message The error message
     */
    public FTPFileOperationException(FTPErrorType errorType, String remotePath, FileOperation operation,
            int ftpReplyCode, String message) {
        super(errorType, remotePath, ftpReplyCode, message, null);
        this.operation = operation;
    }

    /**
     * Gets the file operation that failed.
     *
     * @return The file operation
     */
    public FileOperation getOperation() {
        return operation;
    }
}

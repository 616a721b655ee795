package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.nifi.logging.ComponentLog;
import org.ftpbrowse.controllers.ftp.exception.FTPErrorType;
import org.ftpbrowse.controllers.ftp.exception.FTPFileOperationException;
import org.ftpbrowse.controllers.ftp.exception.FTPFileOperationException.FileOperation;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A secondary control connection opened for a single file transfer, subordinate to an {@link FTPSession}.
 * The transfer counts as finished once the caller closes the transfer stream; the connection itself
 * stays open until the parent session reaps or closes it.
 */
public class FTPChildSession implements Closeable {

    /**
     * Direction of the transfer carried by a child session.
     */
    public enum Direction {
        READ,
        WRITE
    }

    private final String id;
    private final FTPClient client;
    private final String remotePath;
    private final Direction direction;
    private final ComponentLog logger;
    private final AtomicBoolean transferFinished = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    FTPChildSession(FTPClient client, String remotePath, Direction direction, ComponentLog logger) {
        this.id = UUID.randomUUID().toString();
        this.client = client;
        this.remotePath = remotePath;
        this.direction = direction;
        this.logger = logger;
    }

    public String getId() {
        return id;
    }

    public String getRemotePath() {
        return remotePath;
    }

    public Direction getDirection() {
        return direction;
    }

    FTPClient getClient() {
        return client;
    }

    /**
     * @return true once the transfer stream has been closed
     */
    public boolean isTransferFinished() {
        return transferFinished.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    InputStream wrap(InputStream raw) {
        return new FilterInputStream(raw) {
            private final AtomicBoolean streamClosed = new AtomicBoolean(false);

            @Override
            public void close() throws IOException {
                if (streamClosed.compareAndSet(false, true)) {
                    try {
                        super.close();
                        completeTransfer();
                    } finally {
                        transferFinished.set(true);
                    }
                }
            }
        };
    }

    OutputStream wrap(OutputStream raw) {
        return new FilterOutputStream(raw) {
            private final AtomicBoolean streamClosed = new AtomicBoolean(false);

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                if (streamClosed.compareAndSet(false, true)) {
                    try {
                        super.close();
                        completeTransfer();
                    } finally {
                        transferFinished.set(true);
                    }
                }
            }
        };
    }

    private void completeTransfer() throws IOException {
        if (!client.completePendingCommand()) {
            throw new FTPFileOperationException(FTPErrorType.TRANSFER_ERROR, remotePath,
                    direction == Direction.READ ? FileOperation.READ : FileOperation.WRITE,
                    client.getReplyCode(),
                    "Failed to complete transfer of " + remotePath + ": " + client.getReplyString());
        }
        logger.debug("Child session {} finished {} of {}", new Object[] { id, direction, remotePath });
    }

    /**
     * Closes the child connection. Closing twice has no effect.
     *
     * @throws IOException if disconnecting fails
     */
    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            transferFinished.set(true);
            if (client.isConnected()) {
                try {
                    client.logout();
                } catch (IOException e) {
                    logger.debug("Error during child session logout: {}", new Object[] { e.getMessage() });
                }
                client.disconnect();
            }
            logger.debug("Closed child session {}", id);
        }
    }

    @Override
    public String toString() {
        return String.format("FTPChildSession[id=%s, %s %s, finished=%s, closed=%s]",
                id, direction, remotePath, transferFinished.get(), closed.get());
    }
}

package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.nifi.logging.ComponentLog;
import org.ftpbrowse.controllers.ftp.exception.FTPErrorType;
import org.ftpbrowse.controllers.ftp.exception.FTPFileOperationException;
import org.ftpbrowse.controllers.ftp.exception.FTPFileOperationException.FileOperation;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live FTP control connection together with the child connections it spawned for data transfers.
 * <p>
 * A session is used by one caller at a time; the pool guarantees this by keying sessions on the caller context.
 * Eviction may still close a session from another thread, so the child list is a concurrent collection and
 * every close is idempotent.
 */
public class FTPSession implements Closeable {
    private final String id;
    private final FTPConnectionIdentity identity;
    private final FTPClient client;
    private final FTPClientConnector childConnector;
    private final ComponentLog logger;
    private final FTPStatCache statCache = new FTPStatCache();
    private final List<FTPChildSession> children = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a session around an already connected and authenticated client.
     *
     * @param identity the server and credentials of the session
     * @param client the control connection
     * @param childConnector opens the child connections used for transfers
     * @param logger the logger to use
     */
    public FTPSession(FTPConnectionIdentity identity, FTPClient client, FTPClientConnector childConnector,
            ComponentLog logger) {
        this.id = UUID.randomUUID().toString();
        this.identity = identity;
        this.client = client;
        this.childConnector = childConnector;
        this.logger = logger;
    }

    public String getId() {
        return id;
    }

    public FTPConnectionIdentity getIdentity() {
        return identity;
    }

    /**
     * Gets the underlying control connection for operations not covered by this class.
     *
     * @return the Commons Net client
     */
    public FTPClient getClient() {
        return client;
    }

    public FTPStatCache getStatCache() {
        return statCache;
    }

    /**
     * @return true if the session was closed locally or the control socket is gone
     */
    public boolean isClosed() {
        return closed.get() || !client.isConnected();
    }

    /**
     * Sends a NOOP on the control connection.
     *
     * @return true if the server answered with a positive completion reply
     * @throws IOException if the control connection is broken
     */
    public boolean sendNoOp() throws IOException {
        return client.sendNoOp();
    }

    /**
     * Lists a directory and records the metadata of every entry in the stat cache.
     *
     * @param path the absolute remote directory
     * @return the directory entries, without {@code .} and {@code ..}
     * @throws IOException if the transfer fails
     */
    public List<FTPFile> listFiles(String path) throws IOException {
        String directory = normalize(path);
        FTPFile[] files = client.listFiles(directory);
        if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
            throw new FTPFileOperationException(FTPErrorType.FILE_NOT_FOUND, directory, FileOperation.LIST,
                    client.getReplyCode(), "Failed to list " + directory + ": " + client.getReplyString());
        }

        List<FTPFile> result = new ArrayList<>();
        if (files != null) {
            for (FTPFile file : files) {
                if (file == null || ".".equals(file.getName()) || "..".equals(file.getName())) {
                    continue;
                }
                statCache.put(join(directory, file.getName()), file);
                result.add(file);
            }
        }
        logger.debug("Listed {} entries in {}", new Object[] { result.size(), directory });
        return result;
    }

    /**
     * Gets the metadata of a directory entry, listing its parent directory on a cache miss.
     *
     * @param path the absolute remote path
     * @return the entry, or null if the parent directory has no such entry or cannot be listed
     * @throws IOException if listing the parent fails for a reason other than a permanent refusal
     */
    public FTPFile stat(String path) throws IOException {
        String normalized = normalize(path);
        if ("/".equals(normalized)) {
            FTPFile root = new FTPFile();
            root.setName("/");
            root.setType(FTPFile.DIRECTORY_TYPE);
            return root;
        }

        FTPFile cached = statCache.get(normalized);
        if (cached != null) {
            return cached;
        }

        String directory = parent(normalized);
        try {
            listFiles(directory);
        } catch (FTPFileOperationException e) {
            // a parent refused with a permanent reply has no entries
            if (!FTPReply.isNegativePermanent(e.getFtpReplyCode())) {
                throw e;
            }
            logger.debug("Cannot list {} to stat {}: {}", new Object[] { directory, normalized, e.getFtpReplyCode() });
            return null;
        }
        return statCache.get(normalized);
    }

    public boolean exists(String path) throws IOException {
        return stat(path) != null;
    }

    public boolean isDirectory(String path) throws IOException {
        FTPFile file = stat(path);
        return file != null && file.isDirectory();
    }

    /**
     * Opens a file for reading on a new child connection. Closing the returned stream
     * completes the transfer; the child connection is closed when the session is next released.
     *
     * @param path the absolute remote path
     * @return the file content
     * @throws IOException if the child connection or the transfer cannot be started
     */
    public InputStream openForRead(String path) throws IOException {
        String normalized = normalize(path);
        FTPClient childClient = connectChild();
        InputStream raw;
        try {
            raw = childClient.retrieveFileStream(normalized);
        } catch (IOException e) {
            FTPConnectionManager.closeClient(childClient, logger);
            throw e;
        }
        if (raw == null) {
            int reply = childClient.getReplyCode();
            String replyText = childClient.getReplyString();
            FTPConnectionManager.closeClient(childClient, logger);
            throw new FTPFileOperationException(FTPErrorType.FILE_NOT_FOUND, normalized, FileOperation.READ,
                    reply, "Failed to open " + normalized + " for reading: " + replyText);
        }

        FTPChildSession child = new FTPChildSession(childClient, normalized, FTPChildSession.Direction.READ, logger);
        children.add(child);
        logger.debug("Session {} opened child {} to read {}", new Object[] { id, child.getId(), normalized });
        return child.wrap(raw);
    }

    /**
     * Opens a file for writing on a new child connection, replacing any existing content.
     *
     * @param path the absolute remote path
     * @return the stream to write the file content to
     * @throws IOException if the child connection or the transfer cannot be started
     */
    public OutputStream openForWrite(String path) throws IOException {
        String normalized = normalize(path);
        FTPClient childClient = connectChild();
        OutputStream raw;
        try {
            raw = childClient.storeFileStream(normalized);
        } catch (IOException e) {
            FTPConnectionManager.closeClient(childClient, logger);
            throw e;
        }
        if (raw == null) {
            int reply = childClient.getReplyCode();
            String replyText = childClient.getReplyString();
            FTPConnectionManager.closeClient(childClient, logger);
            throw new FTPFileOperationException(FTPErrorType.OPERATION_REFUSED, normalized, FileOperation.WRITE,
                    reply, "Failed to open " + normalized + " for writing: " + replyText);
        }

        statCache.invalidate(normalized);
        FTPChildSession child = new FTPChildSession(childClient, normalized, FTPChildSession.Direction.WRITE, logger);
        children.add(child);
        logger.debug("Session {} opened child {} to write {}", new Object[] { id, child.getId(), normalized });
        return child.wrap(raw);
    }

    public void rename(String from, String to) throws IOException {
        String source = normalize(from);
        String target = normalize(to);
        if (!client.rename(source, target)) {
            throw refused(source, FileOperation.RENAME);
        }
        statCache.invalidate(source);
        statCache.invalidate(target);
    }

    public void remove(String path) throws IOException {
        String normalized = normalize(path);
        if (!client.deleteFile(normalized)) {
            throw refused(normalized, FileOperation.DELETE);
        }
        statCache.invalidate(normalized);
    }

    public void removeDirectory(String path) throws IOException {
        String normalized = normalize(path);
        if (!client.removeDirectory(normalized)) {
            throw refused(normalized, FileOperation.REMOVE_DIRECTORY);
        }
        statCache.invalidate(normalized);
    }

    public void makeDirectory(String path) throws IOException {
        String normalized = normalize(path);
        if (!client.makeDirectory(normalized)) {
            throw refused(normalized, FileOperation.MAKE_DIRECTORY);
        }
        statCache.invalidate(normalized);
    }

    /**
     * @return a snapshot of the child connections currently attached to this session
     */
    public List<FTPChildSession> getChildren() {
        return Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Closes and detaches every child whose transfer has finished.
     * Close errors are logged and ignored.
     *
     * @return the number of children reaped
     */
    public int reapFinishedChildren() {
        int reaped = 0;
        for (FTPChildSession child : children) {
            if (child.isTransferFinished() && children.remove(child)) {
                closeChildQuietly(child);
                reaped++;
            }
        }
        if (reaped > 0) {
            logger.debug("Session {} reaped {} finished child sessions", new Object[] { id, reaped });
        }
        return reaped;
    }

    /**
     * Closes all children, then the control connection. Errors are logged and ignored;
     * closing twice has no effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (FTPChildSession child : children) {
            closeChildQuietly(child);
        }
        children.clear();
        statCache.clear();
        FTPConnectionManager.closeClient(client, logger);
        logger.debug("Closed session {} to {}", new Object[] { id, identity.getBaseUrl() });
    }

    private FTPClient connectChild() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Session " + id + " is closed");
        }
        return childConnector.connect(identity);
    }

    private void closeChildQuietly(FTPChildSession child) {
        try {
            child.close();
        } catch (IOException | RuntimeException e) {
            logger.debug("Ignoring error while closing child session {}: {}",
                    new Object[] { child.getId(), e.getMessage() });
        }
    }

    private FTPFileOperationException refused(String path, FileOperation operation) {
        return new FTPFileOperationException(FTPErrorType.OPERATION_REFUSED, path, operation,
                client.getReplyCode(), operation + " refused for " + path + ": " + client.getReplyString());
    }

    static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    static String parent(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return slash <= 0 ? "/" : normalizedPath.substring(0, slash);
    }

    static String join(String directory, String name) {
        return "/".equals(directory) ? "/" + name : directory + "/" + name;
    }

    @Override
    public String toString() {
        return String.format("FTPSession[id=%s, server=%s, children=%d, closed=%s]",
                id, identity.getBaseUrl(), children.size(), closed.get());
    }
}

package org.ftpbrowse.controllers.ftp;

import java.util.Objects;

/**
 * Canonical identity of a remote FTP location: the server and credentials
 * a session is opened for, plus the residual path the caller asked for.
 * Instances are produced by {@link FTPIdentityResolver}.
 */
public final class FTPConnectionIdentity {
    public static final int DEFAULT_PORT = 21;

    private final FTPScheme scheme;
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String path;

    public FTPConnectionIdentity(FTPScheme scheme, String host, int port, String user, String password, String path) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.host = host == null ? "" : host;
        this.port = port;
        this.user = user == null ? "" : user;
        this.password = password == null ? "" : password;
        this.path = path == null || path.isEmpty() ? "/" : path;
    }

    public FTPScheme getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns a copy of this identity pointing at another path on the same server.
     *
     * @param newPath the residual path
     * @return the new identity
     */
    public FTPConnectionIdentity withPath(String newPath) {
        return new FTPConnectionIdentity(scheme, host, port, user, password, newPath);
    }

    /**
     * Gets the label used to group connections by server and user:
     * {@code scheme://user@host:port}, or {@code scheme://host:port} without a user.
     * The label never carries the password or the path.
     *
     * @return the base URL
     */
    public String getBaseUrl() {
        StringBuilder sb = new StringBuilder(scheme.getPrefix());
        if (!user.isEmpty()) {
            sb.append(user).append('@');
        }
        sb.append(host).append(':').append(port);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FTPConnectionIdentity)) {
            return false;
        }
        FTPConnectionIdentity that = (FTPConnectionIdentity) o;
        return port == that.port
                && scheme == that.scheme
                && host.equals(that.host)
                && user.equals(that.user)
                && password.equals(that.password)
                && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, user, password, path);
    }

    @Override
    public String toString() {
        return String.format("FTPConnectionIdentity[%s, path=%s, password=%s]",
                getBaseUrl(), path, password.isEmpty() ? "none" : "****");
    }
}

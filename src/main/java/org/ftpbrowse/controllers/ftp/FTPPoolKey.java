package org.ftpbrowse.controllers.ftp;

import java.util.Objects;

/**
 * Identity under which a pooled connection is found and reused:
 * the caller context token plus server and credentials. Scheme and path are not part of the key.
 */
public final class FTPPoolKey {
    private final Object callerToken;
    private final String host;
    private final int port;
    private final String user;
    private final String password;

    public FTPPoolKey(Object callerToken, String host, int port, String user, String password) {
        this.callerToken = Objects.requireNonNull(callerToken, "callerToken");
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
    }

    public static FTPPoolKey of(Object callerToken, FTPConnectionIdentity identity) {
        return new FTPPoolKey(callerToken, identity.getHost(), identity.getPort(),
                identity.getUser(), identity.getPassword());
    }

    public Object getCallerToken() {
        return callerToken;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FTPPoolKey)) {
            return false;
        }
        FTPPoolKey that = (FTPPoolKey) o;
        return port == that.port
                && callerToken.equals(that.callerToken)
                && Objects.equals(host, that.host)
                && Objects.equals(user, that.user)
                && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callerToken, host, port, user, password);
    }

    @Override
    public String toString() {
        return "FTPPoolKey[caller=" + callerToken + ", " + user + "@" + host + ":" + port + "]";
    }
}

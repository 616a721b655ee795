package org.ftpbrowse.controllers.ftp;

import java.util.Objects;

/**
 * A server with at least one live pooled connection, and where the user last was on it.
 */
public final class FTPOpenConnection {
    private final String baseUrl;
    private final String lastVisitedUrl;

    public FTPOpenConnection(String baseUrl, String lastVisitedUrl) {
        this.baseUrl = baseUrl;
        this.lastVisitedUrl = lastVisitedUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getLastVisitedUrl() {
        return lastVisitedUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FTPOpenConnection)) {
            return false;
        }
        FTPOpenConnection that = (FTPOpenConnection) o;
        return Objects.equals(baseUrl, that.baseUrl) && Objects.equals(lastVisitedUrl, that.lastVisitedUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseUrl, lastVisitedUrl);
    }

    @Override
    public String toString() {
        return baseUrl + " -> " + lastVisitedUrl;
    }
}

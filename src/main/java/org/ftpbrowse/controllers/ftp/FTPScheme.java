package org.ftpbrowse.controllers.ftp;

import java.util.Locale;

/**
 * URL schemes served by the session pool.
 */
public enum FTPScheme {
    FTP("ftp"),
    /**
     * Explicit FTPS: AUTH TLS on the standard port, then a protected data channel.
     */
    FTPS("ftps");

    private final String value;

    FTPScheme(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the scheme followed by {@code ://}
     */
    public String getPrefix() {
        return value + "://";
    }

    public boolean isSecure() {
        return this == FTPS;
    }

    /**
     * Looks up a scheme by its URL form, ignoring case.
     *
     * @param scheme the scheme as found in a URL
     * @return the matching scheme
     * @throws IllegalArgumentException if the scheme is neither ftp nor ftps
     */
    public static FTPScheme fromValue(String scheme) {
        if (scheme != null) {
            String normalized = scheme.toLowerCase(Locale.ROOT);
            for (FTPScheme candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported URL scheme: " + scheme + " (expected ftp:// or ftps://)");
    }
}

package org.ftpbrowse.controllers.ftp;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns user supplied FTP URLs into canonical {@link FTPConnectionIdentity} instances.
 * <p>
 * When the URL with its path removed is a bookmark alias, the alias target supplies
 * scheme, host, port, user and password while the path of the original URL is kept.
 * Aliases are followed one hop only.
 */
public class FTPIdentityResolver {
    private final FTPBookmarkStore bookmarks;

    public FTPIdentityResolver(FTPBookmarkStore bookmarks) {
        this.bookmarks = bookmarks == null ? FTPBookmarkStore.EMPTY : bookmarks;
    }

    /**
     * Resolves a URL against this resolver's bookmark table.
     *
     * @param url an {@code ftp://} or {@code ftps://} URL
     * @return the canonical identity
     * @throws IllegalArgumentException if the URL cannot be parsed
     */
    public FTPConnectionIdentity resolve(String url) {
        return resolve(url, bookmarks);
    }

    /**
     * Resolves a URL against the given bookmark table.
     *
     * @param url an {@code ftp://} or {@code ftps://} URL
     * @param bookmarks the bookmark table to consult
     * @return the canonical identity
     * @throws IllegalArgumentException if the URL cannot be parsed
     */
    public static FTPConnectionIdentity resolve(String url, FTPBookmarkStore bookmarks) {
        URI uri = parse(url);
        String path = uri.getPath();

        FTPBookmark bookmark = bookmarks == null ? null : bookmarks.getBookmark(stripPath(uri));
        if (bookmark != null) {
            uri = parse(bookmark.getTargetBaseUrl());
        }

        return fromServerUri(uri, path);
    }

    /**
     * Computes the alias lookup key of a URL: the URL text with its path removed.
     *
     * @param url the URL
     * @return the URL without path
     */
    public static String stripPath(String url) {
        return stripPath(parse(url));
    }

    static String stripPath(URI uri) {
        StringBuilder sb = new StringBuilder();
        if (uri.getScheme() != null) {
            sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append(':');
        }
        if (uri.getRawAuthority() != null) {
            sb.append("//").append(uri.getRawAuthority());
        }
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return sb.toString();
    }

    private static FTPConnectionIdentity fromServerUri(URI uri, String path) {
        FTPScheme scheme = FTPScheme.fromValue(uri.getScheme());

        String authority = uri.getRawAuthority() == null ? "" : uri.getRawAuthority();
        String userInfo = null;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            userInfo = authority.substring(0, at);
            authority = authority.substring(at + 1);
        }

        String host;
        String portText = null;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Invalid IPv6 host in URL: " + authority);
            }
            host = authority.substring(1, close);
            if (authority.length() > close + 1 && authority.charAt(close + 1) == ':') {
                portText = authority.substring(close + 2);
            }
        } else {
            int colon = authority.lastIndexOf(':');
            host = colon >= 0 ? authority.substring(0, colon) : authority;
            portText = colon >= 0 ? authority.substring(colon + 1) : null;
        }

        int port = FTPConnectionIdentity.DEFAULT_PORT;
        if (portText != null && !portText.isEmpty()) {
            try {
                port = Integer.parseInt(portText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in URL: " + portText, e);
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            if (port == 0) {
                port = FTPConnectionIdentity.DEFAULT_PORT;
            }
        }

        String user = "";
        String password = "";
        if (userInfo != null) {
            int colon = userInfo.indexOf(':');
            user = unquote(colon >= 0 ? userInfo.substring(0, colon) : userInfo);
            password = colon >= 0 ? unquote(userInfo.substring(colon + 1)) : "";
        }

        return new FTPConnectionIdentity(scheme, host.toLowerCase(Locale.ROOT), port, user, password, path);
    }

    private static URI parse(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL must not be null");
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid FTP URL: " + e.getMessage(), e);
        }
    }

    // percent-decoding only; '+' stays a plus sign
    private static String unquote(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}

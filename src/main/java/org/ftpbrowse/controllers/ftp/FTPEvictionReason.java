package org.ftpbrowse.controllers.ftp;

/**
 * Why a pooled connection left the pool.
 */
public enum FTPEvictionReason {
    IDLE_TIMEOUT,
    CAPACITY,
    SESSION_CLOSED,
    HEALTH_CHECK_FAILED,
    CLOSED_BY_BASE_URL,
    CLOSE_ALL
}

package org.ftpbrowse.controllers.ftp;

/**
 * Enumeration for tracking the lifecycle of a pooled connection entry.
 * An entry that is not in the pool at all is implicitly ABSENT.
 */
public enum FTPConnectionState {
    /**
     * The connection is live but has not answered a NOOP since it was opened or last checked.
     * Fresh entries start here.
     */
    UNVALIDATED,

    /**
     * The connection is live and has just answered a NOOP.
     */
    VALIDATED,

    /**
     * The connection has been removed from the pool and closed.
     */
    EVICTED
}

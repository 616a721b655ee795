package org.ftpbrowse.controllers.ftp;

/**
 * Supplies the token identifying the logical execution context issuing pool requests.
 * Requests carrying different tokens never share a control connection.
 */
@FunctionalInterface
public interface FTPCallerContext {

    /**
     * One context per thread, keyed by thread id.
     */
    FTPCallerContext CURRENT_THREAD = () -> Thread.currentThread().getId();

    /**
     * @return a token with value semantics ({@code equals}/{@code hashCode}) for the calling context
     */
    Object currentToken();
}

package com.cookapi.jobclient.model;

/**
 * Why an operation produced an {@link Result.Err}.
 */
public enum ErrorKind {
    /** The caller passed something the client refuses to send (bad UUID, schema violation). */
    INVALID_REQUEST,
    /** The request never got a response: connection refused, timeout, interruption, SPNEGO failure. */
    TRANSPORT,
    /** The scheduler answered with a non-2xx status or an unreadable body. */
    SCHEDULER
}

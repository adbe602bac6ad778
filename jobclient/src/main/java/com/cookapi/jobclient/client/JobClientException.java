package com.cookapi.jobclient.client;

import com.cookapi.jobclient.model.ErrorKind;

/**
 * Thrown when a request to the scheduler fails.
 *
 * Operations on {@link JobClient} catch it and hand the caller an
 * {@link com.cookapi.jobclient.model.Result.Err} instead; it only escapes
 * through {@link com.cookapi.jobclient.model.Result#orElseThrow()}.
 */
public class JobClientException extends RuntimeException {

    private final ErrorKind kind;

    public JobClientException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JobClientException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}

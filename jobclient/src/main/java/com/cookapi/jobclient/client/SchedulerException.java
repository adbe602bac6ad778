package com.cookapi.jobclient.client;

import com.cookapi.jobclient.model.ErrorKind;

/**
 * The scheduler answered, but not with a usable 2xx response.
 * The message is the reason extracted from the response body.
 */
public class SchedulerException extends JobClientException {

    private final int statusCode;

    public SchedulerException(int statusCode, String reason) {
        super(ErrorKind.SCHEDULER, reason);
        this.statusCode = statusCode;
    }

    public SchedulerException(int statusCode, String reason, Throwable cause) {
        super(ErrorKind.SCHEDULER, reason, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    /**
     * 400 or 404: the scheduler refused one or more of the ids in the request.
     * Authentication and permission failures (401, 403, 407) are not.
     */
    public boolean isJobRejection() {
        return statusCode == 400 || statusCode == 404;
    }
}

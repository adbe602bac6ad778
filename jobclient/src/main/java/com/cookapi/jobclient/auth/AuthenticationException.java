package com.cookapi.jobclient.auth;

import com.cookapi.jobclient.client.JobClientException;
import com.cookapi.jobclient.model.ErrorKind;

/**
 * No credentials could be produced for a request, e.g. no Kerberos ticket
 * in the cache. Reported as a transport failure since nothing was sent.
 */
public class AuthenticationException extends JobClientException {

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}

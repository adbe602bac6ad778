package com.cookapi.jobclient.client;

import com.cookapi.jobclient.model.ErrorKind;

/**
 * The request could not be sent or no response arrived.
 */
public class TransportException extends JobClientException {

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}

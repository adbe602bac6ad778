package com.cookapi.jobclient.client;

/**
 * Thrown by the {@link JobClient} constructor when its configuration cannot
 * work: unsupported auth mode, missing credentials, malformed URL.
 */
public class JobClientConfigurationException extends RuntimeException {

    public JobClientConfigurationException(String message) {
        super(message);
    }

    public JobClientConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.cookapi.jobclient.auth;

import com.cookapi.jobclient.client.JobClientConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Authentication schemes the client can use against the scheduler.
 */
public enum AuthMode {
    HTTP_BASIC("http_basic"),
    KERBEROS("kerberos");

    private final String configValue;

    AuthMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() { return configValue; }

    /**
     * Parses the {@code auth} option. Accepts {@code http_basic}, {@code http-basic}
     * and {@code kerberos}, case-insensitively.
     *
     * @throws JobClientConfigurationException for anything else
     */
    public static AuthMode fromConfig(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (AuthMode m : values()) {
                if (m.configValue.equals(normalized)) return m;
            }
        }
        throw new JobClientConfigurationException("Authentication type " + value + " not supported (expected one of "
                + Arrays.stream(values()).map(AuthMode::configValue).collect(Collectors.joining(", ")) + ")");
    }
}

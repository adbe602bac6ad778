package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of one execution attempt of a job.
 */
public enum InstanceStatus {
    UNKNOWN,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InstanceStatus fromValue(String value) {
        for (InstanceStatus s : values()) {
            if (s.wireValue().equalsIgnoreCase(value)) return s;
        }
        return UNKNOWN;
    }
}

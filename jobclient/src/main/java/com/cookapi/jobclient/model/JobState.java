package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fine-grained job state reported in the {@code state} field.
 * SUCCESS and FAILED are only reached once the job status is COMPLETED.
 */
public enum JobState {
    WAITING,
    RUNNING,
    SUCCESS,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobState fromValue(String value) {
        for (JobState s : values()) {
            if (s.wireValue().equalsIgnoreCase(value)) return s;
        }
        return UNKNOWN;
    }
}

package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse job status reported by the scheduler in the {@code status} field.
 *
 * Transitions:
 *   WAITING → RUNNING → COMPLETED
 *   RUNNING → WAITING (instance failed, retries remain)
 *
 * Values the client does not know map to UNKNOWN.
 */
public enum JobStatus {
    WAITING,
    RUNNING,
    COMPLETED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus s : values()) {
            if (s.wireValue().equalsIgnoreCase(value)) return s;
        }
        return UNKNOWN;
    }
}

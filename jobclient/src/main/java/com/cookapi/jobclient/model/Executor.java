package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.Locale;

/**
 * Executor that launches a job's command on the agent.
 *
 * Descriptors may only name MESOS or COOK. UNKNOWN stands for whatever else a
 * scheduler reports back and is never sent.
 */
public enum Executor {
    MESOS,
    COOK,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isSubmittable() {
        return this != UNKNOWN;
    }

    @JsonCreator
    public static Executor fromValue(String value) {
        Executor e = lenient(value);
        if (!e.isSubmittable()) {
            throw new IllegalArgumentException("Unsupported executor: '" + value + "'");
        }
        return e;
    }

    /** Like {@link #fromValue} but maps anything unrecognised to UNKNOWN. */
    public static Executor lenient(String value) {
        for (Executor e : values()) {
            if (e.isSubmittable() && e.wireValue().equalsIgnoreCase(value)) return e;
        }
        return UNKNOWN;
    }

    /** Reads scheduler responses, where new executor names must not fail the whole record. */
    public static final class LenientDeserializer extends JsonDeserializer<Executor> {
        @Override
        public Executor deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return lenient(p.getValueAsString());
        }
    }
}

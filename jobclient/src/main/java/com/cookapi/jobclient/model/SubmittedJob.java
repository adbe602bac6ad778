package com.cookapi.jobclient.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A descriptor as it was actually sent: UUID resolved, defaults applied.
 * The caller's own {@link JobSpec} is left untouched.
 */
public record SubmittedJob(UUID uuid, JobSpec spec) {

    public SubmittedJob {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(spec, "spec");
    }
}

package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job record returned by {@code GET /rawscheduler} and {@code GET /list}.
 *
 * Only the fields the client reads are declared; anything else the scheduler
 * sends is ignored. {@code submit_time} is epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobInfo(
        UUID                uuid,
        String              name,
        String              command,
        String              user,
        JobStatus           status,
        JobState            state,
        @JsonDeserialize(using = Executor.LenientDeserializer.class)
        Executor            executor,
        Double              cpus,
        Double              mem,
        Integer             gpus,
        Integer             priority,
        Integer             maxRetries,
        Integer             retriesRemaining,
        Long                maxRuntime,
        Long                expectedRuntime,
        Long                submitTime,
        String              frameworkId,
        Boolean             disableMeaCulpaRetries,
        Map<String, String> env,
        List<JobUri>        uris,
        List<InstanceInfo>  instances
) {
    public JobInfo {
        if (status == null)    status = JobStatus.UNKNOWN;
        if (state == null)     state = JobState.UNKNOWN;
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    /**
     * A job is finished once the scheduler reports it completed, or once its
     * state is success/failed (older schedulers only set the latter).
     */
    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal() || state.isTerminal();
    }

    public Optional<Instant> submittedAt() {
        return Optional.ofNullable(submitTime).map(Instant::ofEpochMilli);
    }

    /** Most recent attempt, if the job has been scheduled at least once. */
    public Optional<InstanceInfo> latestInstance() {
        return instances.stream()
                .reduce((a, b) -> startOf(b) >= startOf(a) ? b : a);
    }

    private static long startOf(InstanceInfo i) {
        return i.startTime() == null ? Long.MIN_VALUE : i.startTime();
    }
}

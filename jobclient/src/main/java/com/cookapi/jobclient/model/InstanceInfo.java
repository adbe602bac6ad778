package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Optional;

/**
 * One execution attempt of a job, as embedded in the scheduler's job record.
 * Times are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InstanceInfo(
        String         taskId,
        InstanceStatus status,
        String         hostname,
        String         slaveId,
        String         executorId,
        Long           startTime,
        Long           endTime,
        Integer        reasonCode,
        String         reasonString,
        Integer        exitCode,
        Boolean        preempted,
        String         outputUrl,
        Integer        progress,
        String         progressMessage
) {
    public InstanceInfo {
        if (status == null) status = InstanceStatus.UNKNOWN;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startTime).map(Instant::ofEpochMilli);
    }

    public Optional<Instant> endedAt() {
        return Optional.ofNullable(endTime).map(Instant::ofEpochMilli);
    }
}

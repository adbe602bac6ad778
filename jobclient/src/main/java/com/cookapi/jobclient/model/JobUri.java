package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

/**
 * A resource the agent fetches into the sandbox before running the command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobUri(
        @NotBlank String value,
        Boolean executable,
        Boolean extract,
        Boolean cache
) {
    public static JobUri of(String value) {
        return new JobUri(value, null, null, null);
    }
}

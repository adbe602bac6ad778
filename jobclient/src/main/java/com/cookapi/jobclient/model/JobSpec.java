package com.cookapi.jobclient.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job descriptor sent to {@code POST /rawscheduler}.
 *
 * Every field is optional at construction time. Before submission the client
 * assigns a UUID when none is set and fills unset fields from the configured
 * defaults; {@code max_retries} must be present after that step.
 *
 * Serialized as snake_case JSON with null fields omitted, so the scheduler
 * applies its own defaults for anything left unset.
 *
 * @param maxRuntime      milliseconds
 * @param expectedRuntime milliseconds
 * @param mem             megabytes
 * @param constraints     {@code [attribute, operator, pattern]} triples
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobSpec(
        UUID                               uuid,
        @Size(min = 1) String              name,
        String                             command,
        Executor                           executor,
        @Min(0) @Max(100) Integer          priority,
        @NotNull @Positive Integer         maxRetries,
        @Positive Long                     maxRuntime,
        @Positive Long                     expectedRuntime,
        @Positive Double                   cpus,
        @Positive Double                   mem,
        @PositiveOrZero Integer            gpus,
        @PositiveOrZero Integer            ports,
        List<@Valid JobUri>                uris,
        Map<String, String>                env,
        List<@Size(min = 3, max = 3) List<String>> constraints,
        Boolean                            disableMeaCulpaRetries,
        Map<String, Object>                container
) {

    // Copies keep null entries: {"volumes": null} is a legal container setting.
    public JobSpec {
        if (uris != null)        uris        = copy(uris);
        if (env != null)         env         = copy(env);
        if (constraints != null) constraints = constraints.stream().map(c -> c == null ? null : copy(c)).toList();
        if (container != null)   container   = copy(container);
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static <K, V> Map<K, V> copy(Map<K, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .uuid(uuid).name(name).command(command).executor(executor)
                .priority(priority).maxRetries(maxRetries)
                .maxRuntime(maxRuntime).expectedRuntime(expectedRuntime)
                .cpus(cpus).mem(mem).gpus(gpus).ports(ports)
                .uris(uris).env(env).constraints(constraints)
                .disableMeaCulpaRetries(disableMeaCulpaRetries)
                .container(container);
    }

    /** Copy of this descriptor carrying the given UUID. */
    public JobSpec withUuid(UUID id) {
        return toBuilder().uuid(id).build();
    }

    /**
     * Copy of this descriptor where every unset field takes the value from
     * {@code defaults}. Fields set on this descriptor always win; maps and
     * lists are taken whole, never merged entry by entry.
     */
    public JobSpec withDefaults(JobSpec defaults) {
        if (defaults == null) return this;
        return new JobSpec(
                uuid != null ? uuid : defaults.uuid,
                name != null ? name : defaults.name,
                command != null ? command : defaults.command,
                executor != null ? executor : defaults.executor,
                priority != null ? priority : defaults.priority,
                maxRetries != null ? maxRetries : defaults.maxRetries,
                maxRuntime != null ? maxRuntime : defaults.maxRuntime,
                expectedRuntime != null ? expectedRuntime : defaults.expectedRuntime,
                cpus != null ? cpus : defaults.cpus,
                mem != null ? mem : defaults.mem,
                gpus != null ? gpus : defaults.gpus,
                ports != null ? ports : defaults.ports,
                uris != null ? uris : defaults.uris,
                env != null ? env : defaults.env,
                constraints != null ? constraints : defaults.constraints,
                disableMeaCulpaRetries != null ? disableMeaCulpaRetries : defaults.disableMeaCulpaRetries,
                container != null ? container : defaults.container);
    }

    public static final class Builder {
        private UUID uuid;
        private String name;
        private String command;
        private Executor executor;
        private Integer priority;
        private Integer maxRetries;
        private Long maxRuntime;
        private Long expectedRuntime;
        private Double cpus;
        private Double mem;
        private Integer gpus;
        private Integer ports;
        private List<JobUri> uris;
        private Map<String, String> env;
        private List<List<String>> constraints;
        private Boolean disableMeaCulpaRetries;
        private Map<String, Object> container;

        private Builder() {}

        public Builder uuid(UUID v)                         { this.uuid = v; return this; }
        public Builder name(String v)                       { this.name = v; return this; }
        public Builder command(String v)                    { this.command = v; return this; }
        public Builder executor(Executor v)                 { this.executor = v; return this; }
        public Builder priority(Integer v)                  { this.priority = v; return this; }
        public Builder maxRetries(Integer v)                { this.maxRetries = v; return this; }
        public Builder maxRuntime(Long v)                   { this.maxRuntime = v; return this; }
        public Builder expectedRuntime(Long v)              { this.expectedRuntime = v; return this; }
        public Builder cpus(Double v)                       { this.cpus = v; return this; }
        public Builder mem(Double v)                        { this.mem = v; return this; }
        public Builder gpus(Integer v)                      { this.gpus = v; return this; }
        public Builder ports(Integer v)                     { this.ports = v; return this; }
        public Builder uris(List<JobUri> v)                 { this.uris = v; return this; }
        public Builder env(Map<String, String> v)           { this.env = v; return this; }
        public Builder constraints(List<List<String>> v)    { this.constraints = v; return this; }
        public Builder disableMeaCulpaRetries(Boolean v)    { this.disableMeaCulpaRetries = v; return this; }
        public Builder container(Map<String, Object> v)     { this.container = v; return this; }

        public JobSpec build() {
            return new JobSpec(uuid, name, command, executor, priority, maxRetries,
                    maxRuntime, expectedRuntime, cpus, mem, gpus, ports,
                    uris, env, constraints, disableMeaCulpaRetries, container);
        }
    }
}

package com.cookapi.jobclient.client;

import com.cookapi.jobclient.auth.AuthMode;
import com.cookapi.jobclient.auth.BasicAuthenticator;
import com.cookapi.jobclient.auth.KerberosAuthenticator;
import com.cookapi.jobclient.auth.RequestAuthenticator;
import com.cookapi.jobclient.config.CookClientProperties;
import com.cookapi.jobclient.model.ErrorKind;
import com.cookapi.jobclient.model.JobInfo;
import com.cookapi.jobclient.model.JobSpec;
import com.cookapi.jobclient.model.ListQuery;
import com.cookapi.jobclient.model.ListState;
import com.cookapi.jobclient.model.Result;
import com.cookapi.jobclient.model.SubmittedJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * HTTP client for the Cook scheduler REST API.
 *
 * Translates submit / query / delete / retry / list / wait into calls against
 * {@code /rawscheduler}, {@code /retry} and {@code /list}. Every operation
 * except {@link #waitFor} reports failures as {@link Result.Err} values, never
 * as exceptions; only a bad configuration throws, from the constructor.
 *
 * All I/O is blocking and happens on the calling thread. The instance holds
 * nothing but immutable settings and thread-safe collaborators, so it can be
 * shared.
 */
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    static final String SCHEDULER_ENDPOINT = "/rawscheduler";
    static final String RETRY_ENDPOINT     = "/retry";
    static final String LIST_ENDPOINT      = "/list";

    static final String REQUEST_METRIC = "cook.client.requests";

    private static final TypeReference<List<JobInfo>> JOB_LIST = new TypeReference<>() {};

    // Thread-safe and expensive to build; one per class loader.
    private static final ValidatorFactory VALIDATORS = Validation.buildDefaultValidatorFactory();

    private final String               baseUrl;
    private final AuthMode             authMode;
    private final RequestAuthenticator authenticator;
    private final int                  batchSize;
    private final Duration             requestTimeout;
    private final Duration             pollInterval;
    private final Duration             waitTimeout;     // null = unbounded
    private final JobSpec              jobDefaults;

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final Validator     validator;
    private final MeterRegistry meterRegistry;

    public JobClient(CookClientProperties props) {
        this(props, new ObjectMapper(), new SimpleMeterRegistry());
    }

    /**
     * @throws JobClientConfigurationException if the properties cannot produce a working client
     */
    public JobClient(CookClientProperties props, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.baseUrl        = checkUrl(props.getUrl());
        this.authMode       = AuthMode.fromConfig(props.getAuth());
        this.authenticator  = authenticatorFor(authMode, props);
        this.batchSize      = checkBatchSize(props.getBatchRequestSize());
        this.requestTimeout = checkPositive(props.getRequestTimeout(), "request-timeout");
        this.pollInterval   = checkPositive(props.getWait().getPollInterval(), "wait.poll-interval");
        this.waitTimeout    = checkTimeout(props.getWait().getTimeout());
        this.jobDefaults    = props.getDefaults() == null ? null : props.getDefaults().toJobSpec();

        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.validator     = VALIDATORS.getValidator();
        this.http          = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(checkPositive(props.getConnectTimeout(), "connect-timeout"))
                .build();

        log.info("Cook job client for {} ({} auth, batch size {})", baseUrl, authMode.configValue(), batchSize);
    }

    public String               url()            { return baseUrl; }
    public AuthMode             authMode()       { return authMode; }
    public RequestAuthenticator authenticator()  { return authenticator; }
    public int                  batchSize()      { return batchSize; }
    public Optional<JobSpec>    jobDefaults()    { return Optional.ofNullable(jobDefaults); }

    Validator validator() { return validator; }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Submit jobs in a single {@code POST /rawscheduler}.
     *
     * Descriptors without a UUID get a random one and unset fields take the
     * configured defaults. The caller's descriptors are not modified: the
     * result pairs every resolved UUID with the descriptor actually sent, in
     * input order. Whether the scheduler accepts a partial batch is up to the
     * scheduler; this call reports whatever the single HTTP response says.
     */
    public Result<List<SubmittedJob>> submit(List<JobSpec> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return Result.err(ErrorKind.INVALID_REQUEST, "One or more jobs required");
        }

        List<SubmittedJob> resolved = new ArrayList<>(jobs.size());
        for (JobSpec spec : jobs) {
            UUID id = spec.uuid() != null ? spec.uuid() : UUID.randomUUID();
            resolved.add(new SubmittedJob(id, spec.withUuid(id).withDefaults(jobDefaults)));
        }

        List<String> violations = validate(resolved);
        if (!violations.isEmpty()) {
            log.warn("Rejected submission of {} job(s): {}", jobs.size(), violations);
            return Result.err(ErrorKind.INVALID_REQUEST, String.join("; ", violations));
        }

        try {
            String body = toJson(Map.of("jobs", resolved.stream().map(SubmittedJob::spec).toList()));
            send("submit", request(SCHEDULER_ENDPOINT)
                    .POST(HttpRequest.BodyPublishers.ofString(body)));
            log.info("Submitted {} job(s): {}", resolved.size(),
                    resolved.stream().map(SubmittedJob::uuid).toList());
            return Result.ok(List.copyOf(resolved));
        } catch (JobClientException e) {
            return failure("submit", e);
        }
    }

    // ------------------------------------------------------------------
    // Query / delete / retry
    // ------------------------------------------------------------------

    /**
     * Fetch the current record of each job.
     *
     * Returns exactly one result per input id, in input order. Ids are sent in
     * batches of {@code batch-request-size}; if the scheduler rejects a batch
     * with 400 or 404 (typically because one id is unknown) the batch is retried
     * id by id so the other jobs still get their records.
     */
    public List<Result<JobInfo>> query(List<String> jobs) {
        return inInputOrder(jobs, perBatch("query", distinctValid(jobs), this::queryBatch));
    }

    /**
     * Mark jobs for deletion with {@code DELETE /rawscheduler}. An {@code Ok}
     * only means the scheduler accepted the request, not that the job has
     * stopped. Batching and ordering as in {@link #query}.
     */
    public List<Result<UUID>> delete(List<String> jobs) {
        List<Result<UUID>> results = inInputOrder(jobs, perBatch("delete", distinctValid(jobs), this::deleteBatch));
        log.info("Deleted {} of {} job(s)", results.stream().filter(Result::isOk).count(), jobs.size());
        return results;
    }

    /**
     * Reset the retry budget of each job to {@code retries}, one
     * {@code POST /retry} per job.
     */
    public List<Result<UUID>> retry(List<String> jobs, int retries) {
        if (retries < 0) {
            return jobs.stream()
                    .map(j -> Result.<UUID>err(ErrorKind.INVALID_REQUEST, "Retries must be >= 0, got " + retries))
                    .toList();
        }
        Map<UUID, Result<UUID>> byId = new LinkedHashMap<>();
        for (UUID id : distinctValid(jobs)) {
            try {
                send("retry", request(RETRY_ENDPOINT + "?job=" + id + "&retries=" + retries)
                        .POST(HttpRequest.BodyPublishers.ofString("{}")));
                byId.put(id, Result.ok(id));
            } catch (JobClientException e) {
                byId.put(id, failure("retry of " + id, e));
            }
        }
        log.info("Set {} retries on {} job(s)", retries, byId.values().stream().filter(Result::isOk).count());
        return inInputOrder(jobs, byId);
    }

    /** Results for already-parsed ids, in the given order. Used by {@link JobWaiter}. */
    List<Result<JobInfo>> queryIds(List<UUID> ids) {
        Map<UUID, Result<JobInfo>> byId = perBatch("query", ids, this::queryBatch);
        return ids.stream().map(byId::get).toList();
    }

    private Map<UUID, Result<JobInfo>> queryBatch(List<UUID> batch) {
        HttpResponse<String> resp = send("query",
                request(SCHEDULER_ENDPOINT + "?" + BatchRequests.jobQuery(batch)).GET());
        Map<UUID, JobInfo> returned = parseJobs(resp).stream()
                .filter(j -> j.uuid() != null)
                .collect(Collectors.toMap(JobInfo::uuid, Function.identity(), (a, b) -> a));

        Map<UUID, Result<JobInfo>> results = new LinkedHashMap<>();
        for (UUID id : batch) {
            JobInfo info = returned.get(id);
            results.put(id, info != null
                    ? Result.ok(info)
                    : Result.err(ErrorKind.SCHEDULER, "Job " + id + " missing from scheduler response"));
        }
        return results;
    }

    private Map<UUID, Result<UUID>> deleteBatch(List<UUID> batch) {
        send("delete", request(SCHEDULER_ENDPOINT + "?" + BatchRequests.jobQuery(batch)).DELETE());
        Map<UUID, Result<UUID>> results = new LinkedHashMap<>();
        batch.forEach(id -> results.put(id, Result.ok(id)));
        return results;
    }

    /**
     * Run {@code call} once per batch. A batch rejected with 400 or 404 is split
     * into single-id calls; any other failure fails every id of the batch.
     */
    private <T> Map<UUID, Result<T>> perBatch(String operation, List<UUID> ids,
                                              Function<List<UUID>, Map<UUID, Result<T>>> call) {
        Map<UUID, Result<T>> results = new LinkedHashMap<>();
        for (List<UUID> batch : BatchRequests.partition(ids, batchSize)) {
            results.putAll(runBatch(operation, batch, call));
        }
        return results;
    }

    private <T> Map<UUID, Result<T>> runBatch(String operation, List<UUID> batch,
                                              Function<List<UUID>, Map<UUID, Result<T>>> call) {
        try {
            return call.apply(batch);
        } catch (SchedulerException e) {
            if (batch.size() > 1 && e.isJobRejection()) {
                log.debug("{} of {} jobs rejected with HTTP {}, retrying one by one",
                        operation, batch.size(), e.statusCode());
                Map<UUID, Result<T>> results = new LinkedHashMap<>();
                for (UUID id : batch) {
                    results.putAll(runBatch(operation, List.of(id), call));
                }
                return results;
            }
            return failAll(operation, batch, e);
        } catch (JobClientException e) {
            return failAll(operation, batch, e);
        }
    }

    private <T> Map<UUID, Result<T>> failAll(String operation, List<UUID> batch, JobClientException e) {
        log.warn("{} failed for {}: {}", operation, batch.size() == 1 ? batch.get(0) : batch.size() + " jobs",
                e.getMessage());
        Map<UUID, Result<T>> results = new LinkedHashMap<>();
        batch.forEach(id -> results.put(id, Result.err(e.getKind(), e.getMessage())));
        return results;
    }

    // ------------------------------------------------------------------
    // Listing
    // ------------------------------------------------------------------

    /**
     * Jobs run by a user, filtered by state and submission time
     * ({@code GET /list}).
     */
    public Result<List<JobInfo>> list(ListQuery query) {
        StringBuilder path = new StringBuilder(LIST_ENDPOINT)
                .append("?user=").append(URLEncoder.encode(query.user(), StandardCharsets.UTF_8))
                .append("&state=").append(query.states().stream()
                        .map(ListState::wireValue)
                        .collect(Collectors.joining("%2B")));
        if (query.start() != null) path.append("&start_ms=").append(query.start().toEpochMilli());
        if (query.stop() != null)  path.append("&stop_ms=").append(query.stop().toEpochMilli());
        if (query.limit() != null) path.append("&limit=").append(query.limit());

        try {
            return Result.ok(parseJobs(send("list", request(path.toString()).GET())));
        } catch (JobClientException e) {
            return failure("list", e);
        }
    }

    // ------------------------------------------------------------------
    // Waiting
    // ------------------------------------------------------------------

    /**
     * Wait for jobs using the configured poll interval and timeout.
     *
     * @see #waitFor(List, Duration, Duration)
     */
    public JobWaiter waitFor(List<String> jobs) {
        return waitFor(jobs, waitTimeout, pollInterval);
    }

    /** Wait for jobs with a call-site timeout; null or zero waits forever. */
    public JobWaiter waitFor(List<String> jobs, Duration timeout) {
        return waitFor(jobs, timeout, pollInterval);
    }

    /**
     * Lazily yields each job's final record as soon as it completes.
     *
     * Nothing is sent until the returned waiter is iterated. The first poll is
     * immediate; later polls are {@code pollInterval} apart and stop at the
     * timeout, when the waiter is cancelled, or when every job has completed.
     * A failed poll for one job is logged and retried on the next round.
     *
     * @throws IllegalArgumentException if any id is not a canonical UUID
     */
    public JobWaiter waitFor(List<String> jobs, Duration timeout, Duration pollInterval) {
        List<UUID> ids = new ArrayList<>(jobs.size());
        for (String job : jobs) {
            ids.add(JobIds.parse(job).orElseThrow(() ->
                    new IllegalArgumentException("Invalid job UUID: '" + job + "'")));
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        return new JobWaiter(ids.stream().distinct().toList(), this::queryIds, pollInterval,
                timeout == null || timeout.isZero() ? null : timeout);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String pathAndQuery) {
        URI uri = URI.create(baseUrl + pathAndQuery);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json");
        authenticator.authorizationHeader(uri).ifPresent(h -> builder.header("Authorization", h));
        return builder;
    }

    /** Send and return the response; throws for anything but a 2xx. */
    private HttpResponse<String> send(String operation, HttpRequest.Builder builder) {
        HttpRequest req = builder.build();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            log.debug("{} {}", req.method(), req.uri());
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                outcome = "scheduler_error";
                throw new SchedulerException(resp.statusCode(), reasonFrom(resp));
            }
            return resp;
        } catch (IOException e) {
            outcome = "transport_error";
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new TransportException(req.method() + " " + req.uri() + " failed: " + detail, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = "transport_error";
            throw new TransportException(req.method() + " " + req.uri() + " interrupted", e);
        } finally {
            sample.stop(meterRegistry.timer(REQUEST_METRIC, "operation", operation, "outcome", outcome));
        }
    }

    /**
     * Human-readable reason for a non-2xx response: the {@code error} or
     * {@code message} field of a JSON body, else the raw body, else the status.
     */
    private String reasonFrom(HttpResponse<String> resp) {
        String body = resp.body() == null ? "" : resp.body().strip();
        if (body.isEmpty()) {
            return "HTTP " + resp.statusCode();
        }
        try {
            JsonNode node = json.readTree(body);
            for (String field : List.of("error", "message")) {
                if (node.hasNonNull(field) && node.get(field).isTextual()) {
                    return node.get(field).asText();
                }
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body from {} is not JSON", resp.uri());
        }
        return body;
    }

    private List<JobInfo> parseJobs(HttpResponse<String> resp) {
        try {
            List<JobInfo> jobs = json.readValue(resp.body(), JOB_LIST);
            if (jobs == null) {
                throw new SchedulerException(resp.statusCode(), "Empty job list from scheduler");
            }
            return jobs;
        } catch (JsonProcessingException e) {
            throw new SchedulerException(resp.statusCode(),
                    "Unreadable job list from scheduler: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new JobClientException(ErrorKind.INVALID_REQUEST, "JSON serialization failed: " + e.getOriginalMessage(), e);
        }
    }

    private List<String> validate(List<SubmittedJob> jobs) {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            String prefix = "jobs[" + i + "].";
            JobSpec spec = jobs.get(i).spec();
            validator.validate(spec).stream()
                    .map(v -> prefix + v.getPropertyPath() + " " + v.getMessage())
                    .distinct()
                    .sorted()
                    .forEach(violations::add);
            if (spec.executor() != null && !spec.executor().isSubmittable()) {
                violations.add(prefix + "executor must be mesos or cook");
            }
        }
        return violations;
    }

    private <T> Result<T> failure(String operation, JobClientException e) {
        log.warn("{} failed: {}", operation, e.getMessage());
        return Result.err(e.getKind(), e.getMessage());
    }

    private static List<UUID> distinctValid(List<String> jobs) {
        return jobs.stream()
                .map(JobIds::parse)
                .flatMap(Optional::stream)
                .distinct()
                .toList();
    }

    private static <T> List<Result<T>> inInputOrder(List<String> jobs, Map<UUID, Result<T>> byId) {
        List<Result<T>> out = new ArrayList<>(jobs.size());
        for (String job : jobs) {
            out.add(JobIds.parse(job)
                    .map(byId::get)
                    .orElseGet(() -> Result.err(ErrorKind.INVALID_REQUEST, "Invalid job UUID: '" + job + "'")));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Configuration checks
    // ------------------------------------------------------------------

    private static String checkUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new JobClientConfigurationException("Scheduler url is required");
        }
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        try {
            URI uri = new URI(trimmed);
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())
                    || uri.getHost() == null) {
                throw new JobClientConfigurationException("Scheduler url must be an http(s) URL, got '" + url + "'");
            }
        } catch (URISyntaxException e) {
            throw new JobClientConfigurationException("Malformed scheduler url '" + url + "'", e);
        }
        return trimmed;
    }

    private static RequestAuthenticator authenticatorFor(AuthMode mode, CookClientProperties props) {
        return switch (mode) {
            case HTTP_BASIC -> {
                if (props.getHttpUser() == null) {
                    throw new JobClientConfigurationException("HTTP user is required when authentication is http_basic");
                }
                if (props.getHttpPassword() == null) {
                    throw new JobClientConfigurationException("HTTP password is required when authentication is http_basic");
                }
                yield new BasicAuthenticator(props.getHttpUser(), props.getHttpPassword());
            }
            case KERBEROS -> new KerberosAuthenticator(props.getKerberos().getServiceName());
        };
    }

    private static int checkBatchSize(int size) {
        if (size < 1) {
            throw new JobClientConfigurationException("batch-request-size must be positive, got " + size);
        }
        return size;
    }

    private static Duration checkPositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new JobClientConfigurationException(name + " must be positive, got " + d);
        }
        return d;
    }

    private static Duration checkTimeout(Duration d) {
        if (d != null && d.isNegative()) {
            throw new JobClientConfigurationException("wait.timeout must not be negative, got " + d);
        }
        return d == null || d.isZero() ? null : d;
    }
}

package com.cookapi.jobclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for the Cook REST API, served by the JDK HttpServer.
 *
 * Implements just enough of {@code /rawscheduler}, {@code /retry} and
 * {@code /list} for client tests: jobs live in memory, unknown ids produce a
 * 404 for the whole request (as the real scheduler does), and every request
 * is recorded for assertions.
 */
class FakeCookScheduler implements AutoCloseable {

    record RecordedRequest(String method, String path, String rawQuery, String authorization, String body) {

        List<String> params(String name) {
            return FakeCookScheduler.params(rawQuery, name);
        }
    }

    private record Failure(int status, String body) {}

    private final ObjectMapper json = new ObjectMapper();
    private final Map<UUID, ObjectNode> jobs = new LinkedHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Deque<Failure> failures = new ArrayDeque<>();
    private final HttpServer server;

    private boolean advanceOnQuery;
    private String  requiredAuthorization;

    private FakeCookScheduler() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    static FakeCookScheduler start() throws IOException {
        return new FakeCookScheduler();
    }

    String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // Test controls
    // ------------------------------------------------------------------

    /** Each GET moves every requested job one step: waiting → running → completed/success. */
    synchronized void advanceOnQuery(boolean enabled) {
        this.advanceOnQuery = enabled;
    }

    /** Reject requests whose Authorization header differs with a 401. */
    synchronized void requireAuthorization(String header) {
        this.requiredAuthorization = header;
    }

    /** The next request, whatever it is, gets this response instead. */
    synchronized void failNext(int status, String body) {
        failures.add(new Failure(status, body));
    }

    /** Seed a job as if it had been submitted earlier. */
    synchronized ObjectNode addJob(UUID id, String user) {
        ObjectNode job = json.createObjectNode();
        job.put("uuid", id.toString());
        job.put("command", "true");
        job.put("max_retries", 1);
        job.put("cpus", 1.0);
        job.put("mem", 128.0);
        store(job, user);
        return job;
    }

    synchronized void markRunning(UUID id) {
        ObjectNode job = jobs.get(id);
        job.put("status", "running");
        job.put("state", "running");
        ((ArrayNode) job.get("instances")).add(instance("running"));
    }

    synchronized void markCompleted(UUID id, boolean success) {
        ObjectNode job = jobs.get(id);
        if (job.get("instances").isEmpty()) {
            ((ArrayNode) job.get("instances")).add(instance("running"));
        }
        finish(job, success ? "success" : "failed");
    }

    synchronized ObjectNode job(UUID id) {
        return jobs.get(id);
    }

    synchronized int jobCount() {
        return jobs.size();
    }

    List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    List<RecordedRequest> requests(String method, String path) {
        return requests.stream()
                .filter(r -> r.method().equals(method) && r.path().equals(path))
                .toList();
    }

    // ------------------------------------------------------------------
    // Request handling
    // ------------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        RecordedRequest req = new RecordedRequest(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                body);
        requests.add(req);

        synchronized (this) {
            if (requiredAuthorization != null && !requiredAuthorization.equals(req.authorization())) {
                respond(exchange, 401, error("Unauthorized"));
                return;
            }
            Failure failure = failures.poll();
            if (failure != null) {
                respond(exchange, failure.status(), failure.body());
                return;
            }
            switch (req.method() + " " + req.path()) {
                case "POST /rawscheduler"   -> submit(exchange, req);
                case "GET /rawscheduler"    -> query(exchange, req);
                case "DELETE /rawscheduler" -> delete(exchange, req);
                case "POST /retry"          -> retry(exchange, req);
                case "GET /list"            -> list(exchange, req);
                default -> respond(exchange, 404, error("No route for " + req.method() + " " + req.path()));
            }
        }
    }

    private void submit(HttpExchange exchange, RecordedRequest req) throws IOException {
        JsonNode submitted = json.readTree(req.body()).get("jobs");
        if (submitted == null || !submitted.isArray() || submitted.isEmpty()) {
            respond(exchange, 400, error("Must supply at least one job"));
            return;
        }
        for (JsonNode j : submitted) {
            UUID id = UUID.fromString(j.get("uuid").asText());
            if (jobs.containsKey(id)) {
                respond(exchange, 409, error("UUID " + id + " already used"));
                return;
            }
        }
        ArrayNode created = json.createArrayNode();
        for (JsonNode j : submitted) {
            store(((ObjectNode) j).deepCopy(), userOf(req));
            created.add(j.get("uuid").asText());
        }
        respond(exchange, 201, json.writeValueAsString(created));
    }

    private void query(HttpExchange exchange, RecordedRequest req) throws IOException {
        List<UUID> ids = knownIds(exchange, req.params("job"));
        if (ids == null) return;
        ArrayNode out = json.createArrayNode();
        for (UUID id : ids) {
            ObjectNode job = jobs.get(id);
            if (advanceOnQuery) advance(job);
            out.add(job.deepCopy());
        }
        respond(exchange, 200, json.writeValueAsString(out));
    }

    private void delete(HttpExchange exchange, RecordedRequest req) throws IOException {
        List<UUID> ids = knownIds(exchange, req.params("job"));
        if (ids == null) return;
        for (UUID id : ids) {
            ObjectNode job = jobs.get(id);
            if (!"completed".equals(job.get("status").asText())) finish(job, "failed");
        }
        respond(exchange, 204, null);
    }

    private void retry(HttpExchange exchange, RecordedRequest req) throws IOException {
        List<UUID> ids = knownIds(exchange, req.params("job"));
        if (ids == null) return;
        int retries = Integer.parseInt(req.params("retries").get(0));
        for (UUID id : ids) {
            ObjectNode job = jobs.get(id);
            job.put("max_retries", retries);
            job.put("retries_remaining", retries);
            job.put("status", "waiting");
            job.put("state", "waiting");
        }
        respond(exchange, 201, json.writeValueAsString(ids.stream().map(UUID::toString).toList()));
    }

    private void list(HttpExchange exchange, RecordedRequest req) throws IOException {
        List<String> user = req.params("user");
        if (user.isEmpty()) {
            respond(exchange, 400, error("user is required"));
            return;
        }
        List<String> states = req.params("state").isEmpty()
                ? List.of()
                : List.of(req.params("state").get(0).split("\\+"));
        Long start = req.params("start_ms").isEmpty() ? null : Long.valueOf(req.params("start_ms").get(0));
        Long stop  = req.params("stop_ms").isEmpty() ? null : Long.valueOf(req.params("stop_ms").get(0));
        int limit  = req.params("limit").isEmpty() ? Integer.MAX_VALUE : Integer.parseInt(req.params("limit").get(0));

        ArrayNode out = json.createArrayNode();
        for (ObjectNode job : jobs.values()) {
            long submitted = job.get("submit_time").asLong();
            boolean matches = job.get("user").asText().equals(user.get(0))
                    && (states.contains(job.get("status").asText()) || states.contains(job.get("state").asText()))
                    && (start == null || submitted >= start)
                    && (stop == null || submitted < stop);
            if (matches && out.size() < limit) out.add(job.deepCopy());
        }
        respond(exchange, 200, json.writeValueAsString(out));
    }

    /** The parsed ids, or null after answering with a 400/404. */
    private List<UUID> knownIds(HttpExchange exchange, List<String> raw) throws IOException {
        if (raw.isEmpty()) {
            respond(exchange, 400, error("Must supply at least one job"));
            return null;
        }
        List<UUID> ids = new ArrayList<>();
        for (String s : raw) {
            UUID id;
            try {
                id = UUID.fromString(s);
            } catch (IllegalArgumentException e) {
                respond(exchange, 400, error("Invalid UUID " + s));
                return null;
            }
            if (!jobs.containsKey(id)) {
                respond(exchange, 404, error("UUID " + id + " didn't correspond to a job"));
                return null;
            }
            ids.add(id);
        }
        return ids;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void store(ObjectNode job, String user) {
        job.put("status", "waiting");
        job.put("state", "waiting");
        job.put("user", user);
        job.put("framework_id", "cook-framework-1");
        job.put("submit_time", System.currentTimeMillis());
        job.put("retries_remaining", job.path("max_retries").asInt(1));
        job.put("gpus", job.path("gpus").asInt(0));
        job.set("instances", json.createArrayNode());
        job.put("labels_unknown_to_client", "ignored");
        jobs.put(UUID.fromString(job.get("uuid").asText()), job);
    }

    private void advance(ObjectNode job) {
        switch (job.get("status").asText()) {
            case "waiting" -> {
                job.put("status", "running");
                job.put("state", "running");
                ((ArrayNode) job.get("instances")).add(instance("running"));
            }
            case "running" -> finish(job, "success");
            default -> { }
        }
    }

    private void finish(ObjectNode job, String outcome) {
        job.put("status", "completed");
        job.put("state", outcome);
        for (JsonNode i : job.get("instances")) {
            ObjectNode instance = (ObjectNode) i;
            if ("running".equals(instance.get("status").asText())) {
                instance.put("status", outcome);
                instance.put("end_time", System.currentTimeMillis());
                if ("success".equals(outcome)) instance.put("exit_code", 0);
            }
        }
    }

    private ObjectNode instance(String status) {
        ObjectNode instance = json.createObjectNode();
        instance.put("task_id", UUID.randomUUID().toString());
        instance.put("status", status);
        instance.put("hostname", "agent-1.example.com");
        instance.put("slave_id", "slave-1");
        instance.put("executor_id", "executor-1");
        instance.put("start_time", System.currentTimeMillis());
        instance.put("preempted", false);
        return instance;
    }

    private String error(String message) {
        return json.createObjectNode().put("error", message).toString();
    }

    private static String userOf(RecordedRequest req) {
        String auth = req.authorization();
        if (auth == null || !auth.startsWith("Basic ")) return "anonymous";
        String decoded = new String(Base64.getDecoder().decode(auth.substring(6)), StandardCharsets.UTF_8);
        return decoded.substring(0, decoded.indexOf(':'));
    }

    static List<String> params(String rawQuery, String name) {
        List<String> values = new ArrayList<>();
        if (rawQuery == null || rawQuery.isEmpty()) return values;
        for (String pair : rawQuery.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv[0].equals(name)) {
                values.add(kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "");
            }
        }
        return values;
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}

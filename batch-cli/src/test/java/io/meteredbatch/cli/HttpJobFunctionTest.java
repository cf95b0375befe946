package io.meteredbatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.meteredbatch.core.JobContext;
import io.meteredbatch.core.JobOutcome;
import io.meteredbatch.core.Json;
import io.meteredbatch.core.WorkItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class HttpJobFunctionTest {
    HttpServer server;
    final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ok", ex -> respond(ex, 200, "{\"output\": \"s3://reports/acme.md\"}"));
        server.createContext("/plain", ex -> respond(ex, 201, "created"));
        server.createContext("/denied", ex -> respond(ex, 401, "bad key"));
        server.createContext("/broken", ex -> respond(ex, 503, "try later"));
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HttpJobFunction job(String path) {
        URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
        return new HttpJobFunction(HttpClient.newHttpClient(), uri, Duration.ofSeconds(2));
    }

    static class RecordingContext implements JobContext {
        final List<String> usage = new CopyOnWriteArrayList<>();

        @Override public String runId() { return "20240501_101500_001_acme"; }
        @Override public Duration acquire(String dependency) { return Duration.ZERO; }
        @Override public void record(String kind, long quantity) { usage.add(kind + "=" + quantity); }
    }

    @Test
    void success_takes_output_field_and_records_one_request() throws Exception {
        RecordingContext ctx = new RecordingContext();
        JobOutcome outcome = job("/ok").process(new WorkItem("acme", Map.of("url", "https://acme.example")), ctx);

        assertEquals(JobOutcome.Kind.SUCCESS, outcome.kind());
        assertEquals(Map.of("output", "s3://reports/acme.md"), outcome.outputs());
        assertEquals(List.of("request=1"), ctx.usage);

        JsonNode sent = Json.mapper().readTree(bodies.get(0));
        assertEquals("acme", sent.get("identity").asText());
        assertEquals("20240501_101500_001_acme", sent.get("run_id").asText());
        assertEquals("https://acme.example", sent.get("payload").get("url").asText());
    }

    @Test
    void non_json_body_is_the_output_reference() throws Exception {
        JobOutcome outcome = job("/plain").process(WorkItem.of("acme"), new RecordingContext());
        assertEquals(Map.of("output", "created"), outcome.outputs());
    }

    @Test
    void rejected_credentials_are_fatal() throws Exception {
        JobOutcome outcome = job("/denied").process(WorkItem.of("acme"), new RecordingContext());
        assertEquals(JobOutcome.Kind.FATAL, outcome.kind());
        assertTrue(outcome.error().contains("401"), outcome.error());
    }

    @Test
    void other_statuses_are_item_failures() throws Exception {
        RecordingContext ctx = new RecordingContext();
        JobOutcome outcome = job("/broken").process(WorkItem.of("acme"), ctx);
        assertEquals(JobOutcome.Kind.FAILURE, outcome.kind());
        assertEquals("HTTP 503: try later", outcome.error());
        assertEquals(List.of("request=1"), ctx.usage);
    }

    @Test
    void unreachable_endpoint_is_a_failure_without_usage() throws Exception {
        HttpServer gone = HttpServer.create(new InetSocketAddress(0), 0);
        gone.start();
        int port = gone.getAddress().getPort();
        gone.stop(0);
        HttpJobFunction unreachable = new HttpJobFunction(HttpClient.newHttpClient(),
                URI.create("http://127.0.0.1:" + port + "/ok"), Duration.ofSeconds(1));
        RecordingContext offline = new RecordingContext();
        JobOutcome down = unreachable.process(WorkItem.of("acme"), offline);
        assertEquals(JobOutcome.Kind.FAILURE, down.kind());
        assertTrue(offline.usage.isEmpty());
    }

    @Test
    void declares_the_http_dependency() {
        assertEquals(java.util.Set.of("http"), job("/ok").dependencies());
    }
}

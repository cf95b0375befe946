package io.meteredbatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteredbatch.core.JobContext;
import io.meteredbatch.core.JobFunction;
import io.meteredbatch.core.JobOutcome;
import io.meteredbatch.core.Json;
import io.meteredbatch.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Posts each item as JSON to a metered HTTP endpoint.
 *
 * <p>One {@value #USAGE_KIND} unit is recorded per request sent. A 2xx response is a success whose
 * output reference is the response's {@code output} field (or its body). 401 and 403 mean the
 * credentials are wrong for every item, so they are fatal; any other status is a failure.
 */
public class HttpJobFunction implements JobFunction {
    private static final Logger log = LoggerFactory.getLogger(HttpJobFunction.class);

    public static final String DEPENDENCY = "http";
    public static final String USAGE_KIND = "request";
    static final int MAX_OUTPUT_LENGTH = 200;

    private final HttpClient client;
    private final URI endpoint;
    private final Duration timeout;
    private final ObjectMapper mapper = Json.mapper();

    public HttpJobFunction(HttpClient client, URI endpoint, Duration timeout) {
        this.client = client;
        this.endpoint = endpoint;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(DEPENDENCY);
    }

    @Override
    public JobOutcome process(WorkItem item, JobContext context) throws InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("identity", item.identity());
        body.put("run_id", context.runId());
        body.put("payload", item.payload());

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            return JobOutcome.failure("request to " + endpoint + " failed: " + e);
        }
        context.record(USAGE_KIND, 1);

        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return JobOutcome.success(outputRef(resp.body()));
        }
        if (status == 401 || status == 403) {
            return JobOutcome.fatal("endpoint rejected credentials (HTTP " + status + ")");
        }
        log.debug("HTTP {} for {}", status, item.identity());
        return JobOutcome.failure("HTTP " + status + ": " + abbreviate(resp.body()));
    }

    private String outputRef(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && node.hasNonNull("output")) {
                return node.get("output").asText();
            }
        } catch (IOException e) {
            log.debug("Response body is not JSON, using it as the output reference");
        }
        return abbreviate(body.trim());
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= MAX_OUTPUT_LENGTH ? s : s.substring(0, MAX_OUTPUT_LENGTH);
    }
}

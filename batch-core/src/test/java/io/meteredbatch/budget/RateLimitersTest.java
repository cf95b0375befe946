package io.meteredbatch.budget;

import com.codahale.metrics.MetricRegistry;
import io.meteredbatch.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimitersTest {
    @Test
    void unknown_dependency_is_not_throttled() throws Exception {
        RateLimiters limiters = RateLimiters.none();
        for (int i = 0; i < 100; i++) {
            assertEquals(Duration.ZERO, limiters.acquire("llm"));
        }
        assertNull(limiters.get("llm"));
    }

    @Test
    void records_wait_timer_per_dependency() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        RateLimiters limiters = new RateLimiters(Map.of("http", new RateLimitSpec(5, 5)), new Metrics(registry));
        limiters.acquire("http");
        limiters.acquire("http");
        assertEquals(2, registry.timer("ratelimit.http.wait").getCount());
        assertEquals(1, limiters.stats().size());
        assertEquals(2, limiters.stats().get(0).totalCalls());
        assertTrue(limiters.names().contains("http"));
    }
}

package forgebench.orchestrator.pool;

import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EndpointPoolTest {

    private static final ServiceType STATIC = ServiceType.STATIC_ANALYZER;
    private static final List<String> URLS = List.of("ws://a:2001", "ws://b:2002", "ws://c:2003");

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
    private final AtomicBoolean probeHealthy = new AtomicBoolean(true);
    private final AtomicInteger probes = new AtomicInteger();

    private final HealthProbe probe = (endpoint, timeout) -> {
        probes.incrementAndGet();
        return probeHealthy.get();
    };

    private EndpointPool pool(SelectionStrategy strategy) {
        return new EndpointPool(Map.of(STATIC, URLS), probe, strategy, Duration.ofSeconds(60),
                Duration.ofSeconds(1), clock, new Random(42));
    }

    @Test
    void roundRobinCyclesThroughHealthyEndpoints() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);

        List<String> picked = List.of(
                pool.select(STATIC).orElseThrow().url(),
                pool.select(STATIC).orElseThrow().url(),
                pool.select(STATIC).orElseThrow().url(),
                pool.select(STATIC).orElseThrow().url());

        assertEquals(List.of("ws://a:2001", "ws://b:2002", "ws://c:2003", "ws://a:2001"), picked);
    }

    @Test
    void leastInFlightPrefersIdleEndpointAndBreaksTiesByOrder() {
        EndpointPool pool = pool(SelectionStrategy.LEAST_IN_FLIGHT);
        List<Endpoint> endpoints = pool.endpoints(STATIC);

        assertEquals("ws://a:2001", pool.select(STATIC).orElseThrow().url());

        pool.lease(endpoints.get(0));
        pool.lease(endpoints.get(1));
        assertEquals("ws://c:2003", pool.select(STATIC).orElseThrow().url());

        pool.lease(endpoints.get(2));
        pool.release(endpoints.get(1), 20, true);
        assertEquals("ws://b:2002", pool.select(STATIC).orElseThrow().url());
        assertEquals(1, endpoints.get(1).totalRequests());
    }

    @Test
    void randomPicksOnlyHealthyEndpoints() {
        EndpointPool pool = pool(SelectionStrategy.RANDOM);
        pool.reportFailure(pool.endpoints(STATIC).get(1), "refused");

        for (int i = 0; i < 20; i++) {
            assertNotEquals("ws://b:2002", pool.select(STATIC).orElseThrow().url());
        }
    }

    @Test
    @DisplayName("A failed endpoint is skipped until its cooldown elapses, then re-probed")
    void cooldownGatesResurrection() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);
        Endpoint a = pool.endpoints(STATIC).get(0);
        pool.reportFailure(a, "connection reset");
        assertFalse(a.isHealthy());

        clock.advance(Duration.ofSeconds(30));
        for (int i = 0; i < 6; i++) {
            assertNotEquals(a, pool.select(STATIC).orElseThrow());
        }
        assertEquals(0, probes.get(), "no probe inside the cooldown");

        // cooldown over but the worker is still down: probe fails, cooldown restarts
        probeHealthy.set(false);
        clock.advance(Duration.ofSeconds(31));
        pool.select(STATIC);
        assertEquals(1, probes.get());
        assertFalse(a.isHealthy());

        clock.advance(Duration.ofSeconds(10));
        pool.select(STATIC);
        assertEquals(1, probes.get(), "failed probe restarts the cooldown");

        probeHealthy.set(true);
        clock.advance(Duration.ofSeconds(61));
        assertTrue(pool.select(STATIC).isPresent());
        assertTrue(a.isHealthy());
        assertEquals(2, probes.get());
    }

    @Test
    void noEligibleEndpointYieldsEmpty() {
        EndpointPool pool = pool(SelectionStrategy.LEAST_IN_FLIGHT);
        for (Endpoint endpoint : pool.endpoints(STATIC)) {
            pool.reportFailure(endpoint, "down");
        }

        assertTrue(pool.select(STATIC).isEmpty());
        assertTrue(pool.select(ServiceType.AI_ANALYZER).isEmpty(), "service without endpoints");
    }

    @Test
    void reportSuccessRestoresEndpoint() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);
        Endpoint b = pool.endpoints(STATIC).get(1);
        pool.reportFailure(b, "timeout");

        pool.reportSuccess(b);

        assertTrue(b.isHealthy());
        assertEquals(3, pool.healthyCount(STATIC));
    }

    @Test
    void checkAllProbesEveryEndpoint() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);
        probeHealthy.set(false);

        assertEquals(0, pool.checkAll());
        assertEquals(3, probes.get());
        assertEquals(0, pool.healthyCount(STATIC));

        probeHealthy.set(true);
        assertEquals(3, pool.checkAll());
    }

    @Test
    void statsDescribeEveryService() {
        EndpointPool pool = pool(SelectionStrategy.LEAST_IN_FLIGHT);
        Endpoint a = pool.endpoints(STATIC).get(0);
        pool.lease(a);
        pool.reportFailure(pool.endpoints(STATIC).get(2), "down");

        PoolStats stats = pool.stats();

        assertEquals("least_in_flight", stats.strategy());
        assertEquals(3, stats.totalEndpoints());
        assertEquals(2, stats.healthyEndpoints());
        PoolStats.ServiceStats staticStats = stats.services().get("static-analyzer");
        assertEquals(1, staticStats.inFlight());
        assertEquals(0, stats.services().get("ai-analyzer").total());
    }

    @Test
    void closedPoolSelectsNothing() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);
        pool.close();
        assertTrue(pool.select(STATIC).isEmpty());
    }

    @Test
    void endpointTracksLatencyAndFailures() {
        EndpointPool pool = pool(SelectionStrategy.ROUND_ROBIN);
        Endpoint a = pool.endpoints(STATIC).get(0);

        pool.lease(a);
        pool.release(a, 100, true);
        pool.lease(a);
        pool.release(a, 200, false);

        assertEquals(0, a.inFlight());
        assertEquals(2, a.totalRequests());
        assertEquals(1, a.totalFailures());
        assertTrue(a.avgLatencyMs() > 100 && a.avgLatencyMs() < 200);
        assertEquals("ws://a:2001/static-analyzer", a.dispatchUrl());
    }
}

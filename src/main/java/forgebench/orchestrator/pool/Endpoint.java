package forgebench.orchestrator.pool;

import forgebench.orchestrator.model.ServiceType;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One worker replica of a service type. Health and load counters are
 * mutated only by {@link EndpointPool}; callers read them.
 */
public final class Endpoint {

    private static final double LATENCY_DECAY = 0.8;

    private final ServiceType serviceType;
    private final String url;
    private final int index; // registration order, used for tie-breaking

    private volatile boolean healthy = true;
    private volatile Instant lastHealthCheck;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();
    private final AtomicBoolean probing = new AtomicBoolean();
    private double avgLatencyMs;

    Endpoint(ServiceType serviceType, String url, int index) {
        this.serviceType = Objects.requireNonNull(serviceType, "serviceType is required");
        this.url = Objects.requireNonNull(url, "url is required");
        this.index = index;
    }

    public ServiceType serviceType() {
        return serviceType;
    }

    public String url() {
        return url;
    }

    public int index() {
        return index;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public long totalRequests() {
        return totalRequests.get();
    }

    public long totalFailures() {
        return totalFailures.get();
    }

    public synchronized double avgLatencyMs() {
        return avgLatencyMs;
    }

    /** Full dispatch address: {@code <url>/<service wire name>}. */
    public String dispatchUrl() {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return base + "/" + serviceType.wireName();
    }

    // ========== Pool-side mutators ==========

    /**
     * @return true if the endpoint was unhealthy before
     */
    boolean markHealthy(Instant now) {
        boolean wasUnhealthy = !healthy;
        healthy = true;
        lastHealthCheck = now;
        return wasUnhealthy;
    }

    /**
     * @return true if the endpoint was healthy before
     */
    boolean markUnhealthy(Instant now) {
        boolean wasHealthy = healthy;
        healthy = false;
        lastHealthCheck = now;
        return wasHealthy;
    }

    boolean tryStartProbe() {
        return probing.compareAndSet(false, true);
    }

    void finishProbe() {
        probing.set(false);
    }

    void leased() {
        inFlight.incrementAndGet();
        totalRequests.incrementAndGet();
    }

    synchronized void released(long latencyMs, boolean success) {
        inFlight.updateAndGet(n -> Math.max(0, n - 1));
        if (!success) {
            totalFailures.incrementAndGet();
        }
        avgLatencyMs = avgLatencyMs == 0
                ? latencyMs
                : LATENCY_DECAY * avgLatencyMs + (1 - LATENCY_DECAY) * latencyMs;
    }

    EndpointSnapshot snapshot() {
        return new EndpointSnapshot(serviceType.wireName(), url, healthy, lastHealthCheck,
                inFlight(), totalRequests(), totalFailures(), avgLatencyMs());
    }

    @Override
    public String toString() {
        return "Endpoint{" + serviceType.wireName() + " " + url + ", healthy=" + healthy
                + ", inFlight=" + inFlight + "}";
    }
}

package forgebench.orchestrator.pool;

import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.model.ServiceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-service pool of worker endpoints.
 *
 * <p>
 * Selection only returns endpoints that are healthy, or unhealthy endpoints
 * whose last check is older than the cooldown and which pass a synchronous
 * re-probe. Endpoints are never removed; a failing endpoint is marked
 * unhealthy and re-tested once its cooldown has elapsed.
 *
 * <p>
 * Selection never throws. An empty result means no capacity right now.
 */
public class EndpointPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointPool.class);

    private final Map<ServiceType, List<Endpoint>> endpoints;
    private final Map<ServiceType, AtomicInteger> roundRobin = new EnumMap<>(ServiceType.class);
    private final HealthProbe probe;
    private final SelectionStrategy strategy;
    private final Duration cooldown;
    private final Duration probeTimeout;
    private final Clock clock;
    private final Random random;

    private volatile boolean closed = false;

    public EndpointPool(Map<ServiceType, List<String>> urls, HealthProbe probe, SelectionStrategy strategy,
            Duration cooldown, Duration probeTimeout, Clock clock) {
        this(urls, probe, strategy, cooldown, probeTimeout, clock, new Random());
    }

    public EndpointPool(Map<ServiceType, List<String>> urls, HealthProbe probe, SelectionStrategy strategy,
            Duration cooldown, Duration probeTimeout, Clock clock, Random random) {
        this.probe = probe;
        this.strategy = strategy;
        this.cooldown = cooldown;
        this.probeTimeout = probeTimeout;
        this.clock = clock;
        this.random = random;

        Map<ServiceType, List<Endpoint>> registered = new EnumMap<>(ServiceType.class);
        for (ServiceType type : ServiceType.values()) {
            List<String> serviceUrls = urls.getOrDefault(type, List.of());
            List<Endpoint> list = new ArrayList<>(serviceUrls.size());
            for (int i = 0; i < serviceUrls.size(); i++) {
                list.add(new Endpoint(type, serviceUrls.get(i), i));
            }
            registered.put(type, Collections.unmodifiableList(list));
            roundRobin.put(type, new AtomicInteger());
        }
        this.endpoints = Collections.unmodifiableMap(registered);

        log.info("Endpoint pool initialized: strategy={}, cooldown={}s, endpoints={}",
                strategy, cooldown.toSeconds(), countEndpoints());
    }

    /**
     * Build a pool from configuration.
     */
    public static EndpointPool fromConfig(OrchestratorConfig config, HealthProbe probe) {
        Map<ServiceType, List<String>> urls = new EnumMap<>(ServiceType.class);
        for (ServiceType type : ServiceType.values()) {
            urls.put(type, config.endpointUrls(type));
        }
        return new EndpointPool(urls, probe, config.selectionStrategy(), config.healthCooldown(),
                config.probeTimeout(), Clock.systemUTC());
    }

    /**
     * Select an endpoint for a service type.
     *
     * @return a healthy (or just resurrected) endpoint, or empty if none qualifies
     */
    public Optional<Endpoint> select(ServiceType serviceType) {
        if (closed) {
            return Optional.empty();
        }

        List<Endpoint> candidates = new ArrayList<>();
        for (Endpoint endpoint : endpoints(serviceType)) {
            if (endpoint.isHealthy() || resurrect(endpoint)) {
                candidates.add(endpoint);
            }
        }

        if (candidates.isEmpty()) {
            log.warn("No healthy endpoint available for {}", serviceType.wireName());
            return Optional.empty();
        }

        Endpoint chosen = choose(serviceType, candidates);
        log.debug("Selected {} for {}", chosen.url(), serviceType.wireName());
        return Optional.of(chosen);
    }

    /**
     * Count a dispatch as started on the endpoint.
     */
    public void lease(Endpoint endpoint) {
        endpoint.leased();
    }

    /**
     * Count a dispatch as finished on the endpoint.
     */
    public void release(Endpoint endpoint, long latencyMs, boolean success) {
        endpoint.released(latencyMs, success);
    }

    /**
     * Passive failure reported by a caller after a transport error or timeout.
     * The endpoint becomes unhealthy immediately and a fresh cooldown starts.
     */
    public void reportFailure(Endpoint endpoint, String reason) {
        if (endpoint.markUnhealthy(clock.instant())) {
            log.warn("Endpoint {} marked unhealthy: {}", endpoint.url(), reason);
        } else {
            log.debug("Endpoint {} failed again: {}", endpoint.url(), reason);
        }
    }

    /**
     * Successful dispatch reported by a caller.
     */
    public void reportSuccess(Endpoint endpoint) {
        if (endpoint.markHealthy(clock.instant())) {
            log.info("Endpoint {} is healthy again", endpoint.url());
        }
    }

    /**
     * Actively probe every endpoint, regardless of cooldown.
     *
     * @return number of healthy endpoints after the check
     */
    public int checkAll() {
        if (closed) {
            return 0;
        }
        int healthy = 0;
        for (List<Endpoint> list : endpoints.values()) {
            for (Endpoint endpoint : list) {
                if (!endpoint.tryStartProbe()) {
                    if (endpoint.isHealthy())
                        healthy++;
                    continue;
                }
                try {
                    if (runProbe(endpoint)) {
                        healthy++;
                    }
                } finally {
                    endpoint.finishProbe();
                }
            }
        }
        log.debug("Health check finished: {}/{} endpoints healthy", healthy, countEndpoints());
        return healthy;
    }

    public List<Endpoint> endpoints(ServiceType serviceType) {
        return endpoints.getOrDefault(serviceType, List.of());
    }

    public int healthyCount(ServiceType serviceType) {
        return (int) endpoints(serviceType).stream().filter(Endpoint::isHealthy).count();
    }

    public SelectionStrategy strategy() {
        return strategy;
    }

    public PoolStats stats() {
        Map<String, PoolStats.ServiceStats> services = new LinkedHashMap<>();
        for (Map.Entry<ServiceType, List<Endpoint>> entry : endpoints.entrySet()) {
            List<EndpointSnapshot> snapshots = entry.getValue().stream().map(Endpoint::snapshot).toList();
            int healthy = (int) snapshots.stream().filter(EndpointSnapshot::healthy).count();
            int inFlight = snapshots.stream().mapToInt(EndpointSnapshot::inFlight).sum();
            services.put(entry.getKey().wireName(),
                    new PoolStats.ServiceStats(snapshots.size(), healthy, inFlight, snapshots));
        }
        return new PoolStats(strategy.name().toLowerCase(Locale.ROOT), services);
    }

    @Override
    public void close() {
        closed = true;
        log.info("Endpoint pool closed");
    }

    // ========== Internal ==========

    /**
     * Re-probe an unhealthy endpoint whose cooldown has elapsed. Only one
     * thread probes a given endpoint at a time; others skip it.
     */
    private boolean resurrect(Endpoint endpoint) {
        Instant lastCheck = endpoint.lastHealthCheck();
        Instant now = clock.instant();
        if (lastCheck != null && Duration.between(lastCheck, now).compareTo(cooldown) <= 0) {
            return false;
        }
        if (!endpoint.tryStartProbe()) {
            return false;
        }
        try {
            if (endpoint.isHealthy()) {
                return true;
            }
            log.debug("Cooldown elapsed for {}, re-probing", endpoint.url());
            return runProbe(endpoint);
        } finally {
            endpoint.finishProbe();
        }
    }

    private boolean runProbe(Endpoint endpoint) {
        boolean ok;
        try {
            ok = probe.probe(endpoint, probeTimeout);
        } catch (RuntimeException e) {
            log.debug("Probe of {} threw: {}", endpoint.url(), e.getMessage());
            ok = false;
        }

        Instant now = clock.instant();
        if (ok) {
            if (endpoint.markHealthy(now)) {
                log.info("Endpoint {} resurrected", endpoint.url());
            }
        } else if (endpoint.markUnhealthy(now)) {
            log.warn("Endpoint {} failed health probe", endpoint.url());
        }
        return ok;
    }

    private Endpoint choose(ServiceType serviceType, List<Endpoint> candidates) {
        // candidates are in registration order
        return switch (strategy) {
            case ROUND_ROBIN -> {
                int next = roundRobin.get(serviceType).getAndIncrement();
                yield candidates.get(Math.floorMod(next, candidates.size()));
            }
            case RANDOM -> candidates.get(random.nextInt(candidates.size()));
            case LEAST_IN_FLIGHT -> candidates.stream()
                    .min(Comparator.comparingInt(Endpoint::inFlight).thenComparingInt(Endpoint::index))
                    .orElseThrow();
        };
    }

    private int countEndpoints() {
        return endpoints.values().stream().mapToInt(List::size).sum();
    }
}

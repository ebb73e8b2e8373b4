package forgebench.orchestrator.config;

import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.pool.SelectionStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; {@link #fromEnv()} is read once at startup.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/forgebench;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8090;
    private String serverHost = "0.0.0.0";

    // Endpoint pool settings
    private final Map<ServiceType, List<String>> endpointUrls = new EnumMap<>(ServiceType.class);
    private SelectionStrategy selectionStrategy = SelectionStrategy.LEAST_IN_FLIGHT;
    private Duration healthCooldown = Duration.ofSeconds(60);
    private Duration probeTimeout = Duration.ofSeconds(2);
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration dispatchTimeout = Duration.ofSeconds(600);

    // Scheduling settings
    private int generationMaxConcurrent = 2;
    private int analysisMaxConcurrent = 2;
    private int generationPoolSize = 8;
    private int analysisPoolSize = 8;
    private Duration pollInterval = Duration.ofSeconds(1);
    private int defaultMaxRetries = 3;
    private String generatorUrl = "http://localhost:5055";
    private Duration generationTimeout = Duration.ofMinutes(15);

    // Maintenance settings
    private Duration maintenanceInterval = Duration.ofMinutes(60);
    private Duration runningTimeout = Duration.ofMinutes(120);
    private Duration pendingTimeout = Duration.ofMinutes(240);
    private Duration gracePeriod = Duration.ofMinutes(5);

    // Named lock settings
    private Duration lockTimeout = Duration.ofSeconds(10);
    private Duration lockWait = Duration.ofSeconds(5);

    private OrchestratorConfig() {
        for (ServiceType type : ServiceType.values()) {
            List<String> defaults = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                defaults.add("ws://localhost:" + (type.defaultBasePort() + i));
            }
            endpointUrls.put(type, defaults);
        }
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Build config from an environment lookup (System::getenv in production,
     * a map in tests).
     */
    public static OrchestratorConfig fromEnv(Function<String, String> env) {
        OrchestratorConfig config = new OrchestratorConfig();

        String dbUrl = env.apply("FORGEBENCH_DB_URL");
        if (notBlank(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String port = env.apply("FORGEBENCH_PORT");
        if (notBlank(port)) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        for (ServiceType type : ServiceType.values()) {
            List<String> urls = parseUrls(env.apply(type.envPrefix() + "_URLS"));
            if (urls.isEmpty()) {
                urls = parseUrls(env.apply(type.envPrefix() + "_URL"));
            }
            if (!urls.isEmpty()) {
                config.endpointUrls.put(type, urls);
            }
        }

        String strategy = env.apply("FORGEBENCH_POOL_STRATEGY");
        if (notBlank(strategy)) {
            config.selectionStrategy = SelectionStrategy.parse(strategy);
        }

        config.healthCooldown = seconds(env, "FORGEBENCH_HEALTH_COOLDOWN_SECONDS", config.healthCooldown);
        config.healthCheckInterval = seconds(env, "FORGEBENCH_HEALTH_CHECK_INTERVAL_SECONDS",
                config.healthCheckInterval);
        config.dispatchTimeout = seconds(env, "FORGEBENCH_DISPATCH_TIMEOUT_SECONDS", config.dispatchTimeout);

        String genMax = env.apply("FORGEBENCH_GENERATION_MAX_CONCURRENT");
        if (notBlank(genMax)) {
            config.generationMaxConcurrent = Integer.parseInt(genMax.trim());
        }
        String anMax = env.apply("FORGEBENCH_ANALYSIS_MAX_CONCURRENT");
        if (notBlank(anMax)) {
            config.analysisMaxConcurrent = Integer.parseInt(anMax.trim());
        }

        String maxRetries = env.apply("FORGEBENCH_MAX_RETRIES");
        if (notBlank(maxRetries)) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        config.maintenanceInterval = minutes(env, "FORGEBENCH_MAINTENANCE_INTERVAL_MINUTES",
                config.maintenanceInterval);
        config.runningTimeout = minutes(env, "FORGEBENCH_RUNNING_TIMEOUT_MINUTES", config.runningTimeout);
        config.pendingTimeout = minutes(env, "FORGEBENCH_PENDING_TIMEOUT_MINUTES", config.pendingTimeout);
        config.gracePeriod = minutes(env, "FORGEBENCH_GRACE_PERIOD_MINUTES", config.gracePeriod);

        String generatorUrl = env.apply("FORGEBENCH_GENERATOR_URL");
        if (notBlank(generatorUrl)) {
            config.generatorUrl = generatorUrl.trim();
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public List<String> endpointUrls(ServiceType type) {
        return Collections.unmodifiableList(endpointUrls.getOrDefault(type, List.of()));
    }

    public SelectionStrategy selectionStrategy() {
        return selectionStrategy;
    }

    public Duration healthCooldown() {
        return healthCooldown;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration dispatchTimeout() {
        return dispatchTimeout;
    }

    public int generationMaxConcurrent() {
        return generationMaxConcurrent;
    }

    public int analysisMaxConcurrent() {
        return analysisMaxConcurrent;
    }

    public int generationPoolSize() {
        return generationPoolSize;
    }

    public int analysisPoolSize() {
        return analysisPoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public String generatorUrl() {
        return generatorUrl;
    }

    public Duration generationTimeout() {
        return generationTimeout;
    }

    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    public Duration runningTimeout() {
        return runningTimeout;
    }

    public Duration pendingTimeout() {
        return pendingTimeout;
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public Duration lockWait() {
        return lockWait;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withEndpointUrls(ServiceType type, List<String> urls) {
        this.endpointUrls.put(type, List.copyOf(urls));
        return this;
    }

    public OrchestratorConfig withSelectionStrategy(SelectionStrategy strategy) {
        this.selectionStrategy = strategy;
        return this;
    }

    public OrchestratorConfig withHealthCooldown(Duration cooldown) {
        this.healthCooldown = cooldown;
        return this;
    }

    public OrchestratorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withDispatchTimeout(Duration timeout) {
        this.dispatchTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withGenerationMaxConcurrent(int max) {
        this.generationMaxConcurrent = max;
        return this;
    }

    public OrchestratorConfig withAnalysisMaxConcurrent(int max) {
        this.analysisMaxConcurrent = max;
        return this;
    }

    public OrchestratorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public OrchestratorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public OrchestratorConfig withGeneratorUrl(String url) {
        this.generatorUrl = url;
        return this;
    }

    public OrchestratorConfig withRunningTimeout(Duration timeout) {
        this.runningTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withPendingTimeout(Duration timeout) {
        this.pendingTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withGracePeriod(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
        return this;
    }

    public OrchestratorConfig withMaintenanceInterval(Duration interval) {
        this.maintenanceInterval = interval;
        return this;
    }

    public OrchestratorConfig withLockTimeout(Duration timeout) {
        this.lockTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withLockWait(Duration wait) {
        this.lockWait = wait;
        return this;
    }

    public OrchestratorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public OrchestratorConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public OrchestratorConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withGenerationTimeout(Duration timeout) {
        this.generationTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withPoolSizes(int generationPoolSize, int analysisPoolSize) {
        this.generationPoolSize = generationPoolSize;
        this.analysisPoolSize = analysisPoolSize;
        return this;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseUrls(String raw) {
        List<String> urls = new ArrayList<>();
        if (!notBlank(raw)) {
            return urls;
        }
        for (String part : raw.split(",")) {
            String url = part.trim();
            if (url.startsWith("ws://") || url.startsWith("wss://")) {
                urls.add(url);
            }
        }
        return urls;
    }

    private static Duration seconds(Function<String, String> env, String key, Duration fallback) {
        String value = env.apply(key);
        return notBlank(value) ? Duration.ofSeconds(Long.parseLong(value.trim())) : fallback;
    }

    private static Duration minutes(Function<String, String> env, String key, Duration fallback) {
        String value = env.apply(key);
        return notBlank(value) ? Duration.ofMinutes(Long.parseLong(value.trim())) : fallback;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", strategy=" + selectionStrategy +
                ", cooldown=" + healthCooldown +
                ", generationMax=" + generationMaxConcurrent +
                ", analysisMax=" + analysisMaxConcurrent +
                ", maxRetries=" + defaultMaxRetries +
                '}';
    }
}

package forgebench.orchestrator.model;

import java.util.Locale;

/**
 * Analyzer worker service types. Each value knows its wire name (used in
 * dispatch URLs and persisted task rows) and the environment prefix used to
 * configure its endpoints.
 */
public enum ServiceType {
    STATIC_ANALYZER("static-analyzer", "STATIC_ANALYZER", 2001),
    DYNAMIC_ANALYZER("dynamic-analyzer", "DYNAMIC_ANALYZER", 2011),
    PERFORMANCE_TESTER("performance-tester", "PERF_TESTER", 2021),
    AI_ANALYZER("ai-analyzer", "AI_ANALYZER", 2031);

    private final String wireName;
    private final String envPrefix;
    private final int defaultBasePort;

    ServiceType(String wireName, String envPrefix, int defaultBasePort) {
        this.wireName = wireName;
        this.envPrefix = envPrefix;
        this.defaultBasePort = defaultBasePort;
    }

    public String wireName() {
        return wireName;
    }

    public String envPrefix() {
        return envPrefix;
    }

    public int defaultBasePort() {
        return defaultBasePort;
    }

    /**
     * Resolve a service type from its wire name ("static-analyzer") or enum
     * name ("STATIC_ANALYZER").
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ServiceType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("service name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ServiceType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown service type: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}

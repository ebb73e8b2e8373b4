package forgebench.orchestrator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static mapping from analysis tool name to the analyzer service that runs it.
 * Tools cross the worker boundary by name only.
 */
public final class ToolCatalog {

    private static final Map<String, ServiceType> TOOLS;

    static {
        Map<String, ServiceType> tools = new LinkedHashMap<>();
        for (String tool : List.of("bandit", "pylint", "eslint", "safety", "semgrep", "mypy", "jshint", "vulture")) {
            tools.put(tool, ServiceType.STATIC_ANALYZER);
        }
        for (String tool : List.of("zap", "curl", "nmap")) {
            tools.put(tool, ServiceType.DYNAMIC_ANALYZER);
        }
        for (String tool : List.of("locust", "ab", "aiohttp")) {
            tools.put(tool, ServiceType.PERFORMANCE_TESTER);
        }
        tools.put("requirements-scanner", ServiceType.AI_ANALYZER);
        TOOLS = Collections.unmodifiableMap(tools);
    }

    private ToolCatalog() {
    }

    /**
     * Service owning the given tool.
     *
     * @throws IllegalArgumentException for unknown tools
     */
    public static ServiceType serviceFor(String toolName) {
        return lookup(toolName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis tool: " + toolName));
    }

    public static Optional<ServiceType> lookup(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TOOLS.get(normalize(toolName)));
    }

    public static boolean isKnown(String toolName) {
        return lookup(toolName).isPresent();
    }

    /** All tool names run by a service, in catalog order. */
    public static List<String> toolsFor(ServiceType service) {
        return TOOLS.entrySet().stream()
                .filter(e -> e.getValue() == service)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Group a tool selection by owning service. Services appear in enum order,
     * tools in selection order with duplicates removed.
     *
     * @throws IllegalArgumentException if any tool is unknown
     */
    public static Map<ServiceType, List<String>> partition(Collection<String> toolSelection) {
        Map<ServiceType, Set<String>> grouped = new EnumMap<>(ServiceType.class);
        for (String tool : toolSelection) {
            ServiceType service = serviceFor(tool);
            grouped.computeIfAbsent(service, k -> new LinkedHashSet<>()).add(normalize(tool));
        }
        Map<ServiceType, List<String>> result = new EnumMap<>(ServiceType.class);
        grouped.forEach((service, tools) -> result.put(service, List.copyOf(tools)));
        return result;
    }

    public static Set<String> allTools() {
        return TOOLS.keySet();
    }

    private static String normalize(String toolName) {
        return toolName.trim().toLowerCase(Locale.ROOT);
    }
}

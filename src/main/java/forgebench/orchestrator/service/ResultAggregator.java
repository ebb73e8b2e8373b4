package forgebench.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.model.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-service subtask snapshots into one document.
 *
 * <p>
 * Missing snapshots (failed subtasks) contribute nothing. With no snapshot at
 * all the result is still a valid document with zero findings and status
 * {@code failed}.
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Aggregate the snapshots of the services that produced results.
     *
     * @param requestedServices wire names of every service the task touched
     * @param snapshots         snapshots of services with results; may be empty
     */
    public AggregatedResult aggregate(Collection<String> requestedServices, List<SubtaskSnapshot> snapshots) {
        Set<String> executed = new LinkedHashSet<>();
        List<JsonNode> findings = new ArrayList<>();
        Map<String, Integer> severity = new LinkedHashMap<>();
        Map<String, String> toolStatus = new LinkedHashMap<>();
        Set<String> tools = new LinkedHashSet<>();

        for (SubtaskSnapshot snapshot : snapshots) {
            if (snapshot == null) {
                continue;
            }
            executed.add(snapshot.serviceName());
            findings.addAll(snapshot.findings());

            if (!snapshot.severityBreakdown().isEmpty()) {
                snapshot.severityBreakdown().forEach((level, count) -> severity.merge(normalize(level),
                        count != null ? count : 0, Integer::sum));
            } else {
                for (JsonNode finding : snapshot.findings()) {
                    String level = finding.path("severity").asText("");
                    if (!level.isEmpty()) {
                        severity.merge(normalize(level), 1, Integer::sum);
                    }
                }
            }

            tools.addAll(snapshot.toolsUsed());
            tools.addAll(snapshot.toolStatus().keySet());
            toolStatus.putAll(snapshot.toolStatus());
        }

        List<String> failed = new ArrayList<>();
        for (String service : requestedServices) {
            if (!executed.contains(service)) {
                failed.add(service);
            }
        }

        AnalysisStatus status = rollupStatus(executed.size(), failed.size());
        log.debug("Aggregated {} services ({} failed): {} findings", executed.size(), failed.size(),
                findings.size());

        return new AggregatedResult(status.value(), List.copyOf(executed), List.copyOf(failed), findings.size(),
                List.copyOf(findings), severity, tools.size(), toolStatus);
    }

    /**
     * Serialize a result for storage.
     */
    public String toJson(AggregatedResult result) {
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize aggregated result", e);
        }
    }

    /**
     * Status of a set of terminal parts: all succeeded, none succeeded, or any
     * success at all among failures.
     */
    static AnalysisStatus rollupStatus(int succeeded, int failed) {
        if (succeeded == 0) {
            return AnalysisStatus.FAILED;
        }
        return failed == 0 ? AnalysisStatus.COMPLETED : AnalysisStatus.PARTIAL_SUCCESS;
    }

    private static String normalize(String level) {
        return level.trim().toLowerCase(Locale.ROOT);
    }
}

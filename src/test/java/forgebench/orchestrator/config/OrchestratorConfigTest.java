package forgebench.orchestrator.config;

import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.pool.SelectionStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    @Test
    void defaultsRegisterThreeEndpointsPerService() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertEquals(List.of("ws://localhost:2001", "ws://localhost:2002", "ws://localhost:2003"),
                config.endpointUrls(ServiceType.STATIC_ANALYZER));
        assertEquals(3, config.endpointUrls(ServiceType.AI_ANALYZER).size());
        assertEquals(SelectionStrategy.LEAST_IN_FLIGHT, config.selectionStrategy());
        assertEquals(Duration.ofMinutes(120), config.runningTimeout());
        assertEquals(Duration.ofMinutes(240), config.pendingTimeout());
        assertEquals(Duration.ofMinutes(5), config.gracePeriod());
    }

    @Test
    void readsEnvironment() {
        Map<String, String> env = Map.of(
                "FORGEBENCH_PORT", "9100",
                "STATIC_ANALYZER_URLS", "ws://a:1, ws://b:2 ,http://not-a-ws",
                "PERF_TESTER_URL", "ws://perf:3",
                "FORGEBENCH_POOL_STRATEGY", "round-robin",
                "FORGEBENCH_HEALTH_COOLDOWN_SECONDS", "15",
                "FORGEBENCH_RUNNING_TIMEOUT_MINUTES", "30",
                "FORGEBENCH_MAX_RETRIES", "5");

        OrchestratorConfig config = OrchestratorConfig.fromEnv(env::get);

        assertEquals(9100, config.serverPort());
        assertEquals(List.of("ws://a:1", "ws://b:2"), config.endpointUrls(ServiceType.STATIC_ANALYZER));
        assertEquals(List.of("ws://perf:3"), config.endpointUrls(ServiceType.PERFORMANCE_TESTER));
        assertEquals(SelectionStrategy.ROUND_ROBIN, config.selectionStrategy());
        assertEquals(Duration.ofSeconds(15), config.healthCooldown());
        assertEquals(Duration.ofMinutes(30), config.runningTimeout());
        assertEquals(5, config.defaultMaxRetries());
    }

    @Test
    void strategyAliases() {
        assertEquals(SelectionStrategy.LEAST_IN_FLIGHT, SelectionStrategy.parse("least_loaded"));
        assertEquals(SelectionStrategy.RANDOM, SelectionStrategy.parse("Random"));
        assertThrows(IllegalArgumentException.class, () -> SelectionStrategy.parse("fastest"));
    }
}

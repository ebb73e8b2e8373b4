package forgebench;

import forgebench.orchestrator.config.Dependencies;
import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.server.OrchestratorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Orchestrator entry point.
 *
 * Wires dependencies, starts the admin API and the background loops, then
 * blocks until the JVM is asked to shut down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        OrchestratorNettyServer server = new OrchestratorNettyServer(deps.routerHandler(), config.serverHost());

        try {
            server.start(config.serverPort());
        } catch (RuntimeException e) {
            log.error("Orchestrator failed to start", e);
            deps.close();
            System.exit(1);
            return;
        }
        deps.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down orchestrator...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "forgebench-shutdown"));

        log.info("Orchestrator ready on port {}", server.port());
        stopped.await();
    }
}

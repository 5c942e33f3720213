package org.scoringapi.gateway;

import org.scoringapi.gateway.config.GatewayConfig;
import org.scoringapi.gateway.domain.auth.AuthService;
import org.scoringapi.gateway.domain.service.MethodDispatcher;
import org.scoringapi.gateway.domain.service.ScoringService;
import org.scoringapi.gateway.domain.service.ScoringServiceImpl;
import org.scoringapi.gateway.http.MethodServer;
import org.scoringapi.gateway.store.InMemoryStore;
import org.scoringapi.gateway.store.Store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the scoring gateway.
 *
 * Serves POST /method with two methods:
 * - online_score: score of a client from the supplied personal fields
 * - clients_interests: interests of a list of clients
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Gateway startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        loadLoggingProperties();
        LOG.info("=== Scoring Gateway ===");

        GatewayConfig config = GatewayConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        Store store = new InMemoryStore(Clock.systemDefaultZone(), config.getStoreMaxEntries());
        ScoringService scoringService = new ScoringServiceImpl();
        MethodDispatcher dispatcher = MethodDispatcher.standard(new AuthService(), scoringService, store);

        MethodServer server = new MethodServer(
                config.getHost(), config.getPort(), config.getWorkerThreads(), dispatcher);
        server.start();
        LOG.info(() -> "Starting server at " + config.getHost() + ":" + server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down gateway...");
            server.stop();
            LOG.info("Gateway shutdown complete");
        }));

        LOG.info("Endpoints:");
        LOG.info(() -> "  - Method: POST http://" + config.getHost() + ":" + server.getPort() + "/method");
        LOG.info(() -> "  - Health: http://" + config.getHost() + ":" + server.getPort() + "/health");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Apply the bundled logging.properties unless a config file was given on the command line.
     */
    private void loadLoggingProperties() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load logging.properties", e);
        }
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(GatewayConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}

package org.yafcp;

import org.yafcp.config.AppConfig;
import org.yafcp.config.ConfigManager;
import org.yafcp.config.LoggingSetup;
import org.yafcp.config.PipelineConfig;
import org.yafcp.metrics.RunInfo;
import org.yafcp.processing.PoolCoordinator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches a list of remote CSV files with a bounded pool of workers sharing one queue and one HTTP client,
 * parses each file and logs a preview of its first row together with per-file and whole-run timings.
 * <p>
 * Usage: {@code YAFCP [--sequential] [path/to/config.yaml]}
 */
public class YAFCP {

    private static final Logger LOGGER = Logger.getLogger(YAFCP.class.getName());

    static final String SEQUENTIAL_FLAG = "--sequential";

    private final AppConfig appConfig;
    private final PipelineConfig pipelineConfig;

    /**
     * @param appConfig  loaded and validated configuration
     * @param sequential run with a single worker, keeping every other setting
     */
    public YAFCP(final AppConfig appConfig, final boolean sequential) {
        this.appConfig = Objects.requireNonNull(appConfig, "appConfig cannot be null");
        this.pipelineConfig = sequential ? appConfig.pipeline().sequential() : appConfig.pipeline();
        if (appConfig.locators().isEmpty()) {
            LOGGER.warning("No urls configured, the run will finish immediately.");
        }
    }

    // --- Main Method ---
    public static void main(final String[] args) {
        LoggingSetup.install(Level.INFO);

        final LaunchOptions launchOptions;
        final AppConfig appConfig;
        try {
            launchOptions = parseArgs(args);
            appConfig = ConfigManager.getConfig(launchOptions.configPath());
        } catch (final IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Could not load configuration: " + e.getMessage(), e);
            System.exit(1);
            return;
        }

        try {
            final RunInfo runInfo = new YAFCP(appConfig, launchOptions.sequential()).execute();
            LOGGER.info(String.format("Run finished: %d/%d urls processed by %d workers.",
                    runInfo.completedCount(), runInfo.enqueuedCount(), runInfo.workerCount()));
        } catch (final InterruptedException e) {
            LOGGER.warning("Main execution thread interrupted.");
            Thread.currentThread().interrupt();
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Run aborted during setup: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Command line of the launcher.
     *
     * @param sequential run with a single worker
     * @param configPath explicit config file, null to use the default lookup
     */
    record LaunchOptions(boolean sequential, Path configPath) {
    }

    /**
     * Reads {@code [--sequential] [path/to/config.yaml]} in any order.
     *
     * @throws IllegalArgumentException on an unknown option or a second config path
     */
    static LaunchOptions parseArgs(final String... args) {
        boolean sequential = false;
        Path configPath = null;
        for (final String arg : args) {
            if (SEQUENTIAL_FLAG.equals(arg)) {
                sequential = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (configPath != null) {
                throw new IllegalArgumentException("Only one config path is accepted, got " + configPath + " and " + arg);
            } else {
                configPath = Path.of(arg);
            }
        }
        return new LaunchOptions(sequential, configPath);
    }

    // --- Entry Point ---
    public RunInfo execute() throws InterruptedException {
        LOGGER.info(String.format("Starting run '%s' with %d workers, fetch timeout %dms, processing delay %dms.",
                pipelineConfig.runLabel(), pipelineConfig.workerCount(),
                pipelineConfig.fetchTimeoutMillis(), pipelineConfig.processingDelayMillis()));
        final PoolCoordinator coordinator = PoolCoordinator.forHttp(pipelineConfig, appConfig.parsing());
        return coordinator.run(appConfig.locators());
    }

    PipelineConfig pipelineConfig() {
        return pipelineConfig;
    }
}

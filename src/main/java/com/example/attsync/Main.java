package com.example.attsync;

import com.example.attsync.client.HttpClientFactory;
import com.example.attsync.client.HttpResultReporter;
import com.example.attsync.config.ApplicationConfig;
import com.example.attsync.config.ConfigLoader;
import com.example.attsync.config.ReportConfig;
import com.example.attsync.lock.LockManager;
import com.example.attsync.lock.LockStamp;
import com.example.attsync.model.RunOutcome;
import com.example.attsync.model.RunResult;
import com.example.attsync.service.LoggingResultReporter;
import com.example.attsync.service.SyncService;
import com.example.attsync.util.JsonSupport;
import com.example.attsync.util.Watermarks;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;

/**
 * CLI entry point. The scheduler and the dashboard invoke {@code sync}; operators use
 * {@code lock-status} to see who holds the Access store.
 */
public final class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PARTIAL = 2;

    Main() {
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new Main().run(args);
        } catch (Exception ex) {
            LOGGER.error("Application failed", ex);
            code = EXIT_FAILED;
        }
        System.exit(code);
    }

    int run(String[] args) throws IOException {
        if (args.length == 0 || isHelp(args[0])) {
            printUsage();
            return EXIT_OK;
        }
        ApplicationConfig config = loadConfig();
        String command = args[0].toLowerCase();
        if ("sync".equals(command)) {
            return executeSync(config, Arrays.copyOfRange(args, 1, args.length));
        }
        if ("lock-status".equals(command)) {
            return executeLockStatus(config);
        }
        LOGGER.error("Unknown command: {}", command);
        printUsage();
        return EXIT_FAILED;
    }

    private int executeSync(ApplicationConfig config, String[] options) {
        boolean dryRun = config.getSync().isDryRun();
        LocalDate watermark = null;
        for (int i = 0; i < options.length; i++) {
            String option = options[i];
            if ("--dry-run".equals(option)) {
                dryRun = true;
            } else if ("--watermark".equals(option) && i + 1 < options.length) {
                watermark = Watermarks.parse(options[++i]);
            } else {
                LOGGER.error("Unknown sync option: {}", option);
                printUsage();
                return EXIT_FAILED;
            }
        }
        if (watermark == null) {
            watermark = Watermarks.fromLookback(Clock.systemDefaultZone(), config.getSync().getLookbackDays());
        }
        SyncService service = SyncService.create(config);
        RunResult result = service.run(watermark, dryRun);
        System.out.println(JsonSupport.toJson(result));
        report(config.getReport(), result);
        return exitCode(result.getOutcome());
    }

    private int executeLockStatus(ApplicationConfig config) {
        Path lockPath = config.getLegacy().resolveLockPath();
        LockManager lockManager = new LockManager();
        Optional<Duration> age = lockManager.age(lockPath);
        if (age.isEmpty()) {
            System.out.println("Lock " + lockPath + " is not held");
            return EXIT_OK;
        }
        Optional<LockStamp> stamp = lockManager.readStamp(lockPath);
        String owner = stamp.map(s -> "pid " + s.getProcessId() + " since " + s.getCreatedAt()).orElse("unknown owner");
        boolean stale = age.get().getSeconds() > config.getSync().getStaleLockSeconds();
        System.out.println("Lock " + lockPath + " held by " + owner + ", age " + age.get().getSeconds() + "s"
            + (stale ? " (stale, next run will reclaim it)" : ""));
        return EXIT_OK;
    }

    /**
     * Hands the result to the log and the dashboard. Never fails the run: a problem with
     * the dashboard client is only logged.
     */
    static void report(ReportConfig reportConfig, RunResult result) {
        new LoggingResultReporter().report(result);
        if (!reportConfig.isEnabled()) {
            return;
        }
        try (CloseableHttpClient client = HttpClientFactory.create(reportConfig.getRequestTimeout())) {
            new HttpResultReporter(reportConfig, client).report(result);
        } catch (IOException ex) {
            LOGGER.warn("Failed to close the dashboard client", ex);
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Run result not posted: {}", ex.getMessage());
        }
    }

    static int exitCode(RunOutcome outcome) {
        switch (outcome) {
            case SUCCESS:
            case SKIPPED_BUSY:
                return EXIT_OK;
            case PARTIAL_FAILURE:
                return EXIT_PARTIAL;
            default:
                return EXIT_FAILED;
        }
    }

    private ApplicationConfig loadConfig() throws IOException {
        ConfigLoader loader = new ConfigLoader();
        return loader.loadOrDefaults(loader.location());
    }

    private boolean isHelp(String value) {
        if (value == null) {
            return true;
        }
        String lower = value.toLowerCase();
        return Arrays.asList("-h", "--help", "help").contains(lower);
    }

    private void printUsage() {
        System.out.println("Usage: java -jar <jar> <command>");
        System.out.println("  sync [--dry-run] [--watermark YYYY-MM-DD]  forward punches recorded after the watermark");
        System.out.println("  lock-status                                show who holds the Access store lock");
        System.out.println("Configuration is read from -Dconfig=<file>, default config/application.yaml");
    }
}

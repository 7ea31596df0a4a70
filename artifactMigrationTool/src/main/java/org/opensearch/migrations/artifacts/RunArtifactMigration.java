package org.opensearch.migrations.artifacts;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import org.opensearch.migrations.artifacts.arguments.ArgLogUtils;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.HikariDatabaseClient;
import org.opensearch.migrations.artifacts.checkpoint.InMemoryCheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.JdbcCheckpointStore;
import org.opensearch.migrations.artifacts.config.MigrationConfig;
import org.opensearch.migrations.artifacts.config.MigrationConfigFile;
import org.opensearch.migrations.artifacts.config.StrategyHint;
import org.opensearch.migrations.artifacts.controller.MigrationController;
import org.opensearch.migrations.artifacts.controller.RunReport;
import org.opensearch.migrations.artifacts.controller.RunState;
import org.opensearch.migrations.artifacts.jcommander.EnvVarParameterPuller;
import org.opensearch.migrations.artifacts.store.FileSystemArtifactSource;
import org.opensearch.migrations.artifacts.store.FileSystemArtifactTarget;
import org.opensearch.migrations.artifacts.tracing.OtelMigrationObservability;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import io.opentelemetry.api.GlobalOpenTelemetry;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;

/**
 * Copies every artifact of one directory into another, checkpointing each transfer so that an
 * interrupted run can be restarted with the same {@code --run-id}.  The run report is printed to stdout
 * as JSON; logs go to stderr.
 */
@Slf4j
public class RunArtifactMigration {
    public static final String ENV_PREFIX = "ARTIFACT_MIGRATION_";

    public static final int COMPLETED_EXIT_CODE = 0;
    public static final int FAILED_EXIT_CODE = 1;
    public static final int PAUSED_EXIT_CODE = 2;
    public static final int NO_WORK_LEFT_EXIT_CODE = 3;
    private static final Duration EXIT_DECISION_TIMEOUT = Duration.ofSeconds(30);

    public static class Args {
        @Parameter(
            names = {"--help", "-h"},
            help = true,
            description = "Displays information about how to use this tool")
        boolean help;

        @Parameter(
            names = { "--source-dir", "--sourceDir" },
            description = "Directory whose files are migrated.  Required.")
        String sourceDir;

        @Parameter(
            names = { "--target-dir", "--targetDir" },
            description = "Directory the files are copied into, keeping their relative paths.  Required.")
        String targetDir;

        @Parameter(
            names = { "--config-file", "--configFile" },
            description = "Optional. YAML file with run options in snake_case.  Flags and environment "
                + "variables take precedence over it.")
        String configFile;

        @Parameter(
            names = { "--run-id", "--runId" },
            description = "Optional. Identifier of the run.  Reusing the id of an interrupted run continues it.  "
                + "Default: a random UUID")
        String runId;

        @Parameter(
            names = { "--resume-from-run-id", "--resumeFromRunId" },
            description = "Optional. Artifacts committed by this earlier run are skipped.")
        String resumeFromRunId;

        @Parameter(
            names = { "--strategy", "--strategy-hint", "--strategyHint" },
            description = "Optional. SMALL, MEDIUM, LARGE or AUTO to choose from the total size.  Default: AUTO")
        StrategyHint strategyHint;

        @Parameter(
            names = { "--concurrency-limit", "--concurrencyLimit" },
            description = "Optional. Concurrent transfers per worker pool.  Default: set by the strategy")
        Integer concurrencyLimit;

        @Parameter(
            names = { "--batch-artifact-count", "--batchArtifactCount" },
            description = "Optional. Maximum artifacts per work unit.  Default: set by the strategy")
        Integer batchArtifactCount;

        @Parameter(
            names = { "--batch-byte-size", "--batchByteSize" },
            description = "Optional. Maximum bytes per work unit.  Default: set by the strategy")
        Long batchByteSize;

        @Parameter(
            names = { "--pool-instances", "--poolInstances" },
            description = "Optional. Number of worker pools.  Default: set by the strategy")
        Integer poolInstances;

        @Parameter(
            names = { "--max-retries", "--maxRetries" },
            description = "Optional. Retries of a transient failure before the artifact is left for a later run.  "
                + "Default: 3")
        Integer maxRetries;

        @Parameter(
            names = { "--backoff-base-ms", "--backoffBaseMs" },
            description = "Optional. Delay before the first retry.  Default: 100")
        Long backoffBaseMs;

        @Parameter(
            names = { "--backoff-factor", "--backoffFactor" },
            description = "Optional. Growth of the delay between retries.  Default: 2.0")
        Double backoffFactor;

        @Parameter(
            names = { "--backoff-max-ms", "--backoffMaxMs" },
            description = "Optional. Upper bound of the delay between retries.  Default: 30000")
        Long backoffMaxMs;

        @Parameter(
            names = { "--rate-limit-source", "--rateLimitSource" },
            description = "Optional. Source reads per second, 0 for unlimited.  Default: 0")
        Double rateLimitSource;

        @Parameter(
            names = { "--rate-limit-target", "--rateLimitTarget" },
            description = "Optional. Target writes per second, 0 for unlimited.  Default: 0")
        Double rateLimitTarget;

        @Parameter(
            names = { "--rate-limit-timeout-ms", "--rateLimitTimeoutMs" },
            description = "Optional. Longest wait for a rate limit permit before the attempt fails.  Default: 30000")
        Long rateLimitTimeoutMs;

        @Parameter(
            names = { "--spool-threshold-bytes", "--spoolThresholdBytes" },
            description = "Optional. Artifacts larger than this are buffered on disk instead of in memory.  "
                + "Default: 16777216")
        Long spoolThresholdBytes;

        @Parameter(
            names = { "--systemic-failure-threshold", "--systemicFailureThreshold" },
            description = "Optional. Consecutive exhausted target writes that stop the run.  Default: 5")
        Integer systemicFailureThreshold;

        @Parameter(
            names = { "--lease-duration-ms", "--leaseDurationMs" },
            description = "Optional. How long a claimed artifact stays reserved for its worker without renewal.  "
                + "Default: 300000")
        Long leaseDurationMs;

        @ParametersDelegate
        CheckpointArgs checkpoint = new CheckpointArgs();
    }

    public static class CheckpointArgs {
        @Parameter(
            names = { "--checkpoint-jdbc-url", "--checkpointJdbcUrl" },
            description = "Optional. JDBC url of the checkpoint database.  Without it checkpoints are kept in "
                + "memory and do not survive the process.")
        String jdbcUrl;

        @Parameter(
            names = { "--checkpoint-jdbc-user", "--checkpointJdbcUser" },
            description = "Optional. User for the checkpoint database.")
        String user;

        @Parameter(
            names = { "--checkpoint-jdbc-password", "--checkpointJdbcPassword" },
            description = "Optional. Password for the checkpoint database.")
        String password;

        @Parameter(
            names = { "--checkpoint-table", "--checkpointTable" },
            description = "Optional. Table holding the checkpoint records.  Default: "
                + JdbcCheckpointStore.DEFAULT_TABLE_NAME)
        String table = JdbcCheckpointStore.DEFAULT_TABLE_NAME;
    }

    public static void main(String[] args) throws Exception {
        System.err.println("Starting program with: " + String.join(" ", ArgLogUtils.getRedactedArgs(args)));
        // Logging is shut down by our hook once the run is paused.
        System.setProperty("log4j2.shutdownHookEnabled", "false");

        var arguments = EnvVarParameterPuller.injectFromEnv(new Args(), ENV_PREFIX);
        var jCommander = JCommander.newBuilder().addObject(arguments).build();
        jCommander.parse(args);
        if (arguments.help) {
            jCommander.usage();
            return;
        }

        var exitStatus = new ExitStatus();
        int exitCode;
        try {
            exitCode = execute(arguments, System.out, pause -> Runtime.getRuntime().addShutdownHook(new Thread(
                shutdownHook(pause, exitStatus, LogManager::shutdown, Runtime.getRuntime()::halt),
                "artifact-migration-shutdown")));
        } catch (ParameterException e) {
            log.atError().setMessage("Invalid arguments: {}").addArgument(e::getMessage).log();
            jCommander.usage();
            exitCode = FAILED_EXIT_CODE;
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Artifact migration failed").log();
            exitCode = FAILED_EXIT_CODE;
        }
        exitStatus.decide(exitCode);
        System.exit(exitCode);
    }

    /**
     * Exit code decided by the main thread, handed to the shutdown hook.
     */
    static final class ExitStatus {
        private final CountDownLatch decided = new CountDownLatch(1);
        private volatile int code = FAILED_EXIT_CODE;

        void decide(int exitCode) {
            this.code = exitCode;
            decided.countDown();
        }

        boolean isDecided() {
            return decided.getCount() == 0;
        }

        OptionalInt await(Duration timeout) throws InterruptedException {
            return decided.await(timeout.toMillis(), TimeUnit.MILLISECONDS)
                ? OptionalInt.of(code)
                : OptionalInt.empty();
        }
    }

    /**
     * Pauses the run, then stops logging.  When the shutdown came from a signal rather than from
     * {@code System.exit}, the main thread's exit call can no longer set the status, so the hook waits for
     * the code the main thread decides and halts with it.
     */
    static Runnable shutdownHook(Runnable pauseRun, ExitStatus exitStatus, Runnable stopLogging, IntConsumer halt) {
        return () -> {
            boolean signalled = !exitStatus.isDecided();
            OptionalInt exitCode = OptionalInt.empty();
            try {
                pauseRun.run();
                if (signalled) {
                    exitCode = exitStatus.await(EXIT_DECISION_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                stopLogging.run();
            }
            exitCode.ifPresent(halt);
        };
    }

    /**
     * Runs one migration to the end of its segment.
     *
     * @param shutdownHooks receives the action that pauses the run when the process is asked to stop
     * @return the process exit code for the run's outcome
     */
    static int execute(Args arguments, PrintStream out, Consumer<Runnable> shutdownHooks) throws Exception {
        validateArgs(arguments);
        var config = buildConfig(arguments);
        try (var store = createCheckpointStore(arguments.checkpoint)) {
            store.setup();
            var target = Path.of(arguments.targetDir);
            Files.createDirectories(target);
            var observability = new OtelMigrationObservability(GlobalOpenTelemetry.get());
            try (var controller = new MigrationController(new FileSystemArtifactSource(Path.of(arguments.sourceDir)),
                new FileSystemArtifactTarget(target), store, observability)) {
                var handle = controller.start(config);
                var runId = handle.getRunId();
                shutdownHooks.accept(() -> pauseOnShutdown(controller, runId));
                var report = handle.awaitCompletion();
                out.println(report.toJson());
                return exitCodeFor(report);
            }
        }
    }

    private static void pauseOnShutdown(MigrationController controller, String runId) {
        if (controller.status(runId).getState() != RunState.RUNNING) {
            return;
        }
        log.atWarn().setMessage("Received shutdown signal, pausing run {}").addArgument(runId).log();
        try {
            var report = controller.pause(runId);
            log.atInfo().setMessage("Run {} is {} after the shutdown signal")
                .addArgument(runId).addArgument(report::getState).log();
        } catch (InterruptedException e) {
            log.atError().setMessage("Pausing run {} was interrupted").addArgument(runId).log();
            Thread.currentThread().interrupt();
        }
    }

    public static void validateArgs(Args args) {
        if (args.sourceDir == null) {
            throw new ParameterException("--source-dir is required");
        }
        if (args.targetDir == null) {
            throw new ParameterException("--target-dir is required");
        }
        if (!Files.isDirectory(Path.of(args.sourceDir))) {
            throw new ParameterException("--source-dir " + args.sourceDir + " is not a directory");
        }
        if (Path.of(args.sourceDir).toAbsolutePath().normalize()
            .equals(Path.of(args.targetDir).toAbsolutePath().normalize())) {
            throw new ParameterException("--source-dir and --target-dir must differ");
        }
        if (args.checkpoint.jdbcUrl == null && (args.checkpoint.user != null || args.checkpoint.password != null)) {
            throw new ParameterException("--checkpoint-jdbc-user and --checkpoint-jdbc-password require "
                + "--checkpoint-jdbc-url");
        }
    }

    /**
     * Layers the YAML file, then everything set by flags or environment variables, over the defaults.
     */
    static MigrationConfig buildConfig(Args args) throws IOException {
        var builder = MigrationConfig.builder();
        if (args.configFile != null) {
            log.atInfo().setMessage("Loading run options from {}").addArgument(args.configFile).log();
            MigrationConfigFile.loadFrom(args.configFile).applyTo(builder);
        }
        setIfPresent(args.runId, builder::runId);
        setIfPresent(args.resumeFromRunId, builder::resumeFromRunId);
        setIfPresent(args.strategyHint, builder::strategyHint);
        setIfPresent(args.concurrencyLimit, builder::concurrencyLimit);
        setIfPresent(args.batchArtifactCount, builder::batchArtifactCount);
        setIfPresent(args.batchByteSize, builder::batchByteSize);
        setIfPresent(args.poolInstances, builder::poolInstances);
        setIfPresent(args.maxRetries, builder::maxRetries);
        setIfPresent(args.backoffBaseMs, builder::backoffBaseMs);
        setIfPresent(args.backoffFactor, builder::backoffFactor);
        setIfPresent(args.backoffMaxMs, builder::backoffMaxMs);
        setIfPresent(args.rateLimitSource, builder::rateLimitSource);
        setIfPresent(args.rateLimitTarget, builder::rateLimitTarget);
        setIfPresent(args.rateLimitTimeoutMs, builder::rateLimitTimeoutMs);
        setIfPresent(args.spoolThresholdBytes, builder::spoolThresholdBytes);
        setIfPresent(args.systemicFailureThreshold, builder::systemicFailureThreshold);
        setIfPresent(args.leaseDurationMs, builder::leaseDurationMs);
        try {
            return builder.build().validate();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }

    private static <T> void setIfPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    static CheckpointStore createCheckpointStore(CheckpointArgs args) {
        if (args.jdbcUrl == null) {
            log.atWarn().setMessage("No --checkpoint-jdbc-url given, checkpoints will not outlive this process").log();
            return new InMemoryCheckpointStore();
        }
        log.atInfo().setMessage("Using checkpoint table {} at {}").addArgument(args.table).addArgument(args.jdbcUrl).log();
        return new JdbcCheckpointStore(new HikariDatabaseClient(args.jdbcUrl, args.user, args.password), args.table);
    }

    static int exitCodeFor(RunReport report) {
        switch (report.getState()) {
            case COMPLETED:
                return report.getDispatched() == 0 ? NO_WORK_LEFT_EXIT_CODE : COMPLETED_EXIT_CODE;
            case PAUSED:
                return PAUSED_EXIT_CODE;
            default:
                return FAILED_EXIT_CODE;
        }
    }
}

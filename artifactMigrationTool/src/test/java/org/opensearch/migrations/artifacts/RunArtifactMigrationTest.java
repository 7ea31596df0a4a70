package org.opensearch.migrations.artifacts;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.opensearch.migrations.artifacts.config.StrategyHint;
import org.opensearch.migrations.artifacts.controller.RunReport;
import org.opensearch.migrations.artifacts.controller.RunState;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunArtifactMigrationTest {
    @TempDir
    Path sourceDir;

    @TempDir
    Path workDir;

    private Path targetDir;
    private final List<Runnable> shutdownHooks = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        targetDir = workDir.resolve("target");
        Files.createDirectories(sourceDir.resolve("libs"));
        Files.writeString(sourceDir.resolve("libs/core-1.0.jar"), "core bytes");
        Files.writeString(sourceDir.resolve("libs/util-2.1.jar"), "util bytes");
        Files.writeString(sourceDir.resolve("README"), "readme");
    }

    private static RunArtifactMigration.Args parse(String... args) {
        var parsed = new RunArtifactMigration.Args();
        JCommander.newBuilder().addObject(parsed).build().parse(args);
        return parsed;
    }

    private int execute(ByteArrayOutputStream out, String... args) throws Exception {
        return RunArtifactMigration.execute(parse(args), new PrintStream(out, true, StandardCharsets.UTF_8),
            shutdownHooks::add);
    }

    @Test
    void copiesEveryFileAndPrintsTheReport() throws Exception {
        var out = new ByteArrayOutputStream();

        int exitCode = execute(out, "--source-dir", sourceDir.toString(), "--target-dir", targetDir.toString(),
            "--run-id", "cli-run");

        assertEquals(RunArtifactMigration.COMPLETED_EXIT_CODE, exitCode);
        assertEquals("core bytes", Files.readString(targetDir.resolve("libs/core-1.0.jar")));
        assertEquals("util bytes", Files.readString(targetDir.resolve("libs/util-2.1.jar")));
        assertEquals("readme", Files.readString(targetDir.resolve("README")));
        var report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("cli-run", report.get("runId").asText());
        assertEquals("COMPLETED", report.get("state").asText());
        assertEquals(3, report.get("committed").asInt());
        assertEquals(1, shutdownHooks.size());
    }

    @Test
    void rerunAgainstPersistentCheckpointsFindsNoWork() throws Exception {
        var jdbcUrl = "jdbc:h2:mem:cli-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
        String[] args = { "--source-dir", sourceDir.toString(), "--target-dir", targetDir.toString(),
            "--run-id", "persistent", "--checkpoint-jdbc-url", jdbcUrl };

        assertEquals(RunArtifactMigration.COMPLETED_EXIT_CODE, execute(new ByteArrayOutputStream(), args));
        var out = new ByteArrayOutputStream();
        assertEquals(RunArtifactMigration.NO_WORK_LEFT_EXIT_CODE, execute(out, args));

        var report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(3, report.get("skippedAlreadyDone").asInt());
    }

    @Test
    void flagsOverrideTheConfigFile() throws Exception {
        var configFile = workDir.resolve("run.yaml");
        Files.writeString(configFile, "max_retries: 5\nstrategy_hint: LARGE\nbackoff_base_ms: 250\n");

        var config = RunArtifactMigration.buildConfig(parse("--source-dir", sourceDir.toString(),
            "--target-dir", targetDir.toString(), "--config-file", configFile.toString(), "--max-retries", "1"));

        assertEquals(1, config.getMaxRetries());
        assertEquals(StrategyHint.LARGE, config.getStrategyHint());
        assertEquals(250, config.getBackoffBaseMs());
        assertNull(config.getRunId());
    }

    @Test
    void invalidOptionsAreReportedAsParameterErrors() {
        assertThrows(ParameterException.class, () -> RunArtifactMigration.buildConfig(parse("--concurrency-limit", "0")));
        assertThrows(ParameterException.class, () -> RunArtifactMigration.validateArgs(parse("--target-dir", "/tmp/x")));
        assertThrows(ParameterException.class, () -> RunArtifactMigration.validateArgs(
            parse("--source-dir", sourceDir.toString(), "--target-dir", sourceDir.toString())));
        assertThrows(ParameterException.class, () -> RunArtifactMigration.validateArgs(
            parse("--source-dir", sourceDir.toString(), "--target-dir", targetDir.toString(),
                "--checkpoint-jdbc-password", "secret")));
    }

    @Test
    void exitCodesFollowTheRunOutcome() {
        assertEquals(RunArtifactMigration.COMPLETED_EXIT_CODE,
            RunArtifactMigration.exitCodeFor(report(RunState.COMPLETED, 3)));
        assertEquals(RunArtifactMigration.NO_WORK_LEFT_EXIT_CODE,
            RunArtifactMigration.exitCodeFor(report(RunState.COMPLETED, 0)));
        assertEquals(RunArtifactMigration.PAUSED_EXIT_CODE,
            RunArtifactMigration.exitCodeFor(report(RunState.PAUSED, 3)));
        assertEquals(RunArtifactMigration.FAILED_EXIT_CODE,
            RunArtifactMigration.exitCodeFor(report(RunState.FAILED, 3)));
    }

    @Test
    void shutdownHookAfterCompletionLeavesTheRunAlone() throws Exception {
        execute(new ByteArrayOutputStream(), "--source-dir", sourceDir.toString(),
            "--target-dir", targetDir.toString());

        shutdownHooks.forEach(Runnable::run);

        assertTrue(Files.exists(targetDir.resolve("README")));
    }

    @Test
    void signalledShutdownHaltsWithTheExitCodeOfThePausedRun() {
        var exitStatus = new RunArtifactMigration.ExitStatus();
        var halted = new ArrayList<Integer>();
        var loggingStopped = new AtomicBoolean();
        Runnable pauseThenMainThreadDecides = () -> exitStatus.decide(RunArtifactMigration.PAUSED_EXIT_CODE);

        RunArtifactMigration.shutdownHook(pauseThenMainThreadDecides, exitStatus,
            () -> loggingStopped.set(true), halted::add).run();

        assertEquals(List.of(RunArtifactMigration.PAUSED_EXIT_CODE), halted);
        assertTrue(loggingStopped.get());
    }

    @Test
    void shutdownFromSystemExitDoesNotHalt() {
        var exitStatus = new RunArtifactMigration.ExitStatus();
        exitStatus.decide(RunArtifactMigration.COMPLETED_EXIT_CODE);
        var halted = new ArrayList<Integer>();
        var loggingStopped = new AtomicBoolean();

        RunArtifactMigration.shutdownHook(() -> {}, exitStatus, () -> loggingStopped.set(true), halted::add).run();

        assertTrue(halted.isEmpty());
        assertTrue(loggingStopped.get());
    }

    private static RunReport report(RunState state, long dispatched) {
        return RunReport.builder().runId("r").state(state).dispatched(dispatched).build();
    }
}

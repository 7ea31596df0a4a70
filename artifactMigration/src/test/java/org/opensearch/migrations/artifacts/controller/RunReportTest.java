package org.opensearch.migrations.artifacts.controller;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class RunReportTest {

    private static RunStatus.RunStatusBuilder status() {
        return RunStatus.builder()
            .runId("run-7")
            .state(RunState.COMPLETED)
            .strategy("SMALL")
            .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
            .totalArtifacts(4)
            .dispatched(4)
            .committed(3)
            .failedFatal(1)
            .bytesCommitted(3000)
            .failures(List.of(new FailureDetail("a/b.bin", "FAILED_FATAL", "IntegrityException", "bad checksum", 1)));
    }

    @Test
    void ratesAreComputedFromElapsedTime() {
        var report = RunReport.from(status().build(), Instant.parse("2024-05-01T10:00:02Z"));

        assertEquals(2000, report.getElapsedMillis());
        assertEquals(1.5, report.getArtifactsPerSecond(), 1e-9);
        assertEquals(1500.0, report.getBytesPerSecond(), 1e-9);
    }

    @Test
    void jsonCarriesCountsAndFailuresAndOmitsMissingReason() throws Exception {
        var report = RunReport.from(status().build(), Instant.parse("2024-05-01T10:00:02Z"));

        var json = new ObjectMapper().readTree(report.toJson());

        assertEquals("run-7", json.get("runId").asText());
        assertEquals("COMPLETED", json.get("state").asText());
        assertEquals("2024-05-01T10:00:00Z", json.get("startedAt").asText());
        assertEquals(3, json.get("committed").asLong());
        assertEquals("IntegrityException", json.get("failures").get(0).get("errorClass").asText());
        assertFalse(json.has("failureReason"));
    }

    @Test
    void failedRunCarriesItsReason() throws Exception {
        var report = RunReport.from(status().state(RunState.FAILED).failureReason("source unavailable").build(),
            Instant.parse("2024-05-01T10:00:00Z"));

        var json = new ObjectMapper().readTree(report.toJson());

        assertEquals("FAILED", json.get("state").asText());
        assertEquals("source unavailable", json.get("failureReason").asText());
        assertEquals(0, json.get("elapsedMillis").asLong());
    }
}

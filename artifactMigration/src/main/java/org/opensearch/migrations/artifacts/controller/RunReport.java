package org.opensearch.migrations.artifacts.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Value;

/**
 * Final summary of a run segment, emitted when the pools drain (or when the run fails before they start).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "runId", "state", "strategy", "startedAt", "finishedAt", "elapsedMillis" })
public class RunReport {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    String runId;
    RunState state;
    String strategy;
    Instant startedAt;
    Instant finishedAt;
    long elapsedMillis;
    int totalArtifacts;
    long dispatched;
    long committed;
    long failedRetryable;
    long failedFatal;
    long skippedAlreadyDone;
    long abandoned;
    long bytesCommitted;
    double artifactsPerSecond;
    double bytesPerSecond;
    List<FailureDetail> failures;
    String failureReason;

    public static RunReport from(RunStatus status, Instant finishedAt) {
        var elapsed = status.getStartedAt() == null ? Duration.ZERO : Duration.between(status.getStartedAt(), finishedAt);
        double seconds = Math.max(elapsed.toMillis(), 1) / 1000.0;
        return RunReport.builder()
            .runId(status.getRunId())
            .state(status.getState())
            .strategy(status.getStrategy())
            .startedAt(status.getStartedAt())
            .finishedAt(finishedAt)
            .elapsedMillis(elapsed.toMillis())
            .totalArtifacts(status.getTotalArtifacts())
            .dispatched(status.getDispatched())
            .committed(status.getCommitted())
            .failedRetryable(status.getFailedRetryable())
            .failedFatal(status.getFailedFatal())
            .skippedAlreadyDone(status.getSkippedAlreadyDone())
            .abandoned(status.getAbandoned())
            .bytesCommitted(status.getBytesCommitted())
            .artifactsPerSecond(status.getCommitted() / seconds)
            .bytesPerSecond(status.getBytesCommitted() / seconds)
            .failures(status.getFailures())
            .failureReason(status.getFailureReason())
            .build();
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize the report of run " + runId, e);
        }
    }
}

package org.opensearch.migrations.artifacts.controller;

import lombok.Value;

/** One artifact that ended the run in a failed state. */
@Value
public class FailureDetail {
    String identity;
    String state;
    String errorClass;
    String message;
    int attempts;
}

package io.b2mash.updatescheduler.execution;

import io.b2mash.updatescheduler.history.ExecutionStatus;
import java.util.UUID;

/** Result of one execution attempt, mirroring the history entry written for it. */
public record ExecutionOutcome(
    UUID scheduleId,
    ExecutionStatus status,
    UUID createdUpdateId,
    boolean emailSent,
    long executionTimeMs,
    String errorMessage) {}

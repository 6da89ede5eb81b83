package com.daniel.eprec.eprecapi.sync;

import java.time.Instant;

// Result of one refresh cycle. Published to RefreshOutcomeListener beans; nothing else acts on it.
public record RefreshOutcome(
        Status status,
        String reason,
        Instant finishedAt
) {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static RefreshOutcome success(String reason) {
        return new RefreshOutcome(Status.SUCCESS, reason, Instant.now());
    }

    public static RefreshOutcome skipped(String reason) {
        return new RefreshOutcome(Status.SKIPPED, reason, Instant.now());
    }

    public static RefreshOutcome failed(String reason) {
        return new RefreshOutcome(Status.FAILED, reason, Instant.now());
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}

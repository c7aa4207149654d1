package com.eainde.analysis.state;

import com.eainde.analysis.model.UsageCounters;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one stage execution. The payload tree is copied on the way in and on the way out,
 * so a result appended to a ledger can never change afterwards.
 */
public record StageResult(
        StageName stage,
        JsonNode payload,
        StageError error,
        Instant startedAt,
        Instant finishedAt,
        UsageCounters usage) {

    public StageResult {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        if (finishedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("finishedAt before startedAt for " + stage);
        }
        payload = payload == null || payload.isNull() ? null : payload.deepCopy();
        usage = usage == null ? UsageCounters.ZERO : usage;
    }

    public static StageResult success(StageName stage, JsonNode payload, Instant startedAt, Instant finishedAt,
                                      UsageCounters usage) {
        return new StageResult(stage, payload, null, startedAt, finishedAt, usage);
    }

    public static StageResult failure(StageName stage, JsonNode partialPayload, StageError error,
                                      Instant startedAt, Instant finishedAt, UsageCounters usage) {
        return new StageResult(stage, partialPayload, Objects.requireNonNull(error, "error"),
                startedAt, finishedAt, usage);
    }

    @Override
    public JsonNode payload() {
        return payload == null ? null : payload.deepCopy();
    }

    public boolean failed() {
        return error != null;
    }
}

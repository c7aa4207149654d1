package com.eainde.analysis.stage;

import com.eainde.analysis.model.UsageCounters;

/**
 * Typed result of a stage body together with what producing it cost.
 */
public record StageOutput<T>(T payload, UsageCounters usage) {

    public static <T> StageOutput<T> free(T payload) {
        return new StageOutput<>(payload, UsageCounters.ZERO);
    }
}

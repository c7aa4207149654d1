package com.eainde.analysis.model;

import com.eainde.analysis.state.StageName;
import com.eainde.analysis.state.StageResult;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-stage usage in canonical stage order plus the cumulative total.
 */
public record UsageSummary(Map<StageName, UsageCounters> stages, UsageCounters total) implements Serializable {

    public UsageSummary {
        stages = stages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        total = total == null ? UsageCounters.ZERO : total;
    }

    public static UsageSummary of(Collection<StageResult> results) {
        Map<StageName, UsageCounters> perStage = new LinkedHashMap<>();
        UsageCounters total = UsageCounters.ZERO;
        for (StageResult result : results) {
            perStage.put(result.stage(), result.usage());
            total = total.plus(result.usage());
        }
        return new UsageSummary(perStage, total);
    }
}

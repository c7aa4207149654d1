package com.eainde.analysis.state;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.UsageSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time copy of a {@link PipelineLedger}; the form that is persisted and served.
 */
public record LedgerSnapshot(
        String runId,
        AnalysisKey key,
        RunStatus status,
        List<StageResult> stages,
        AnalysisReport finalReport,
        Instant createdAt,
        Instant completedAt) {

    public LedgerSnapshot {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public UsageSummary usage() {
        return UsageSummary.of(stages);
    }

    public Optional<StageResult> lastResult() {
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
    }

    public Optional<StageError> error() {
        return lastResult().map(StageResult::error);
    }
}

package com.eainde.analysis.controller;

import com.eainde.analysis.model.UsageSummary;
import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.RunStatus;
import com.eainde.analysis.state.StageError;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.state.StageResult;

import java.time.Instant;
import java.util.List;

/**
 * What the existence check returns: where a run stands and what it has used so far.
 */
public record AnalysisSummaryView(
        String runId,
        String subject,
        String extractionModel,
        String analysisModel,
        RunStatus status,
        List<StageName> completedStages,
        StageError error,
        UsageSummary usage,
        Instant createdAt,
        Instant completedAt) {

    public static AnalysisSummaryView of(LedgerSnapshot snapshot) {
        List<StageName> completed = snapshot.stages().stream()
                .filter(result -> !result.failed())
                .map(StageResult::stage)
                .toList();
        return new AnalysisSummaryView(
                snapshot.runId(),
                snapshot.key().subject(),
                snapshot.key().extractionModel(),
                snapshot.key().analysisModel(),
                snapshot.status(),
                completed,
                snapshot.error().orElse(null),
                snapshot.usage(),
                snapshot.createdAt(),
                snapshot.completedAt());
    }
}

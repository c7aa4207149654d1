package com.eainde.analysis.controller;

import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.UsageSummary;
import com.eainde.analysis.state.LedgerSnapshot;

import java.time.Instant;

public record AnalysisResultView(String runId, AnalysisReport report, UsageSummary usage, Instant completedAt) {

    public static AnalysisResultView of(LedgerSnapshot snapshot) {
        return new AnalysisResultView(snapshot.runId(), snapshot.finalReport(), snapshot.usage(),
                snapshot.completedAt());
    }
}

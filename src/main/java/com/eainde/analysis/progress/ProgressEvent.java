package com.eainde.analysis.progress;

import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.state.StageError;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.state.StageResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One observable transition of a run: a stage result, or the terminal outcome.
 */
public record ProgressEvent(
        Type type,
        StageName stage,
        int ordinal,
        int total,
        JsonNode payload,
        StageError error,
        AnalysisReport report,
        Instant timestamp) {

    public enum Type {
        STAGE,
        COMPLETE,
        FAILED
    }

    public static ProgressEvent stage(StageResult result) {
        return new ProgressEvent(Type.STAGE, result.stage(), result.stage().ordinalNumber(), StageName.total(),
                result.payload(), result.error(), null, result.finishedAt());
    }

    public static ProgressEvent completed(AnalysisReport report, Instant at) {
        return new ProgressEvent(Type.COMPLETE, null, StageName.total(), StageName.total(), null, null, report, at);
    }

    public static ProgressEvent failed(StageName stage, StageError error, Instant at) {
        int ordinal = stage == null ? 0 : stage.ordinalNumber();
        return new ProgressEvent(Type.FAILED, stage, ordinal, StageName.total(), null, error, null, at);
    }

    public boolean terminal() {
        return type != Type.STAGE;
    }
}

package com.eainde.analysis.controller;

import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.progress.ProgressEvent;
import com.eainde.analysis.state.RunStatus;
import com.eainde.analysis.state.StageError;
import com.eainde.analysis.state.StageName;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * SSE payloads of the progress stream.
 */
public final class StreamEventView {

    public static final String STAGE = "stage";
    public static final String COMPLETE = "complete";
    public static final String FAILED = "failed";

    private StreamEventView() {
    }

    public record Stage(StageName stage, int ordinal, int total, JsonNode payload, StageError error,
                        Instant timestamp) {
    }

    public record Terminal(RunStatus status, StageName stage, AnalysisReport report, StageError error,
                           Instant timestamp) {
    }

    public static String name(ProgressEvent event) {
        return switch (event.type()) {
            case STAGE -> STAGE;
            case COMPLETE -> COMPLETE;
            case FAILED -> FAILED;
        };
    }

    public static Object body(ProgressEvent event) {
        return switch (event.type()) {
            case STAGE -> new Stage(event.stage(), event.ordinal(), event.total(), event.payload(), event.error(),
                    event.timestamp());
            case COMPLETE -> new Terminal(RunStatus.COMPLETE, null, event.report(), null, event.timestamp());
            case FAILED -> new Terminal(RunStatus.FAILED, event.stage(), null, event.error(), event.timestamp());
        };
    }
}

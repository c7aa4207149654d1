package com.eainde.analysis.edges;

import com.eainde.analysis.state.AnalysisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Continues to the next stage unless the last one failed.
 */
public class StageRoutingEdge implements AsyncEdgeAction<AnalysisState> {

    public static final String NEXT = "next";
    public static final String FAILED = "failed";

    @Override
    public CompletableFuture<String> apply(AnalysisState state) {
        return CompletableFuture.completedFuture(state.hasFailed() ? FAILED : NEXT);
    }
}

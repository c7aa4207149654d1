package com.eainde.analysis.nodes;

import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph node running one stage through the {@link StageRunner}. On success the typed payload is stored in
 * the state under {@link #stateKey()}; on failure the state is marked failed and the routing edge ends the
 * graph. The returned future never completes exceptionally.
 */
public abstract class StageNode<T> implements AsyncNodeAction<AnalysisState> {

    private final StageRunner runner;

    protected StageNode(StageRunner runner) {
        this.runner = runner;
    }

    public abstract StageName stage();

    protected abstract String stateKey();

    protected abstract StageOutput<T> execute(AnalysisState state) throws Exception;

    protected StageRunner runner() {
        return runner;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AnalysisState state) {
        Map<String, Object> update = runner.run(state.getRunId(), stage(), () -> execute(state))
                .<Map<String, Object>>map(payload -> Map.of(stateKey(), payload))
                .orElseGet(() -> AnalysisState.failedAt(stage()));
        return CompletableFuture.completedFuture(update);
    }
}

package com.eainde.analysis.nodes;

import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.stage.AnalysisAdapter;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;

public class AnalyzeNode extends StageNode<GuardedAnalysis> {

    private final AnalysisAdapter analysis;

    public AnalyzeNode(StageRunner runner, AnalysisAdapter analysis) {
        super(runner);
        this.analysis = analysis;
    }

    @Override
    public StageName stage() {
        return StageName.ANALYZE;
    }

    @Override
    protected String stateKey() {
        return AnalysisState.ANALYSIS;
    }

    @Override
    protected StageOutput<GuardedAnalysis> execute(AnalysisState state) {
        return analysis.analyze(state.getFacts(), state.getMetrics(), state.getValidation(),
                state.getKey().analysisModel());
    }
}

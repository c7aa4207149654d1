package com.eainde.analysis.nodes;

import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.stage.MetricsCalculator;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;

public class CalculateNode extends StageNode<DerivedMetrics> {

    private final MetricsCalculator calculator;

    public CalculateNode(StageRunner runner, MetricsCalculator calculator) {
        super(runner);
        this.calculator = calculator;
    }

    @Override
    public StageName stage() {
        return StageName.CALCULATE;
    }

    @Override
    protected String stateKey() {
        return AnalysisState.METRICS;
    }

    @Override
    protected StageOutput<DerivedMetrics> execute(AnalysisState state) {
        return StageOutput.free(calculator.calculate(state.getFacts(), state.getSource().stockPrice()));
    }
}

package com.eainde.analysis.nodes;

import com.eainde.analysis.error.ConsistencyContradictionException;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.stage.ConsistencyChecker;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;

/**
 * Fails the run on the first contradiction; warnings travel on in the state.
 */
public class ValidateNode extends StageNode<ValidationReport> {

    private final ConsistencyChecker checker;

    public ValidateNode(StageRunner runner, ConsistencyChecker checker) {
        super(runner);
        this.checker = checker;
    }

    @Override
    public StageName stage() {
        return StageName.VALIDATE;
    }

    @Override
    protected String stateKey() {
        return AnalysisState.VALIDATION;
    }

    @Override
    protected StageOutput<ValidationReport> execute(AnalysisState state) {
        ValidationReport report = checker.check(state.getFacts(), state.getMetrics());
        if (report.hasContradictions()) {
            throw new ConsistencyContradictionException(report);
        }
        return StageOutput.free(report);
    }
}

package com.eainde.analysis.nodes;

import com.eainde.analysis.error.ReportFormatException;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.stage.ReportFormatter;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;

public class FormatNode extends StageNode<AnalysisReport> {

    private final ReportFormatter formatter;

    public FormatNode(StageRunner runner, ReportFormatter formatter) {
        super(runner);
        this.formatter = formatter;
    }

    @Override
    public StageName stage() {
        return StageName.FORMAT;
    }

    @Override
    protected String stateKey() {
        return AnalysisState.REPORT;
    }

    @Override
    protected StageOutput<AnalysisReport> execute(AnalysisState state) {
        try {
            return StageOutput.free(formatter.format(state.getKey().subject(), state.getFacts(), state.getMetrics(),
                    state.getValidation(), state.getAnalysis(), runner().usageSoFar(state.getRunId())));
        } catch (IllegalStateException e) {
            throw new ReportFormatException("Format input is incomplete: " + e.getMessage(), e);
        }
    }
}

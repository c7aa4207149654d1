package com.eainde.analysis.nodes;

import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.stage.ExtractionAdapter;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.StageRunner;

public class ExtractNode extends StageNode<FinancialFacts> {

    private final ExtractionAdapter extraction;

    public ExtractNode(StageRunner runner, ExtractionAdapter extraction) {
        super(runner);
        this.extraction = extraction;
    }

    @Override
    public StageName stage() {
        return StageName.EXTRACT;
    }

    @Override
    protected String stateKey() {
        return AnalysisState.FACTS;
    }

    @Override
    protected StageOutput<FinancialFacts> execute(AnalysisState state) {
        return extraction.extract(state.getSource(), state.getKey().extractionModel());
    }
}

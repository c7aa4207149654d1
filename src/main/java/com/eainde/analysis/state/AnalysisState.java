package com.eainde.analysis.state;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.source.SourceDocument;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;
import java.util.Optional;

/**
 * Graph state threaded through the five stage nodes. Holds the typed output of every finished stage;
 * the run's ledger is looked up through {@link #getRunId()}.
 */
public class AnalysisState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String KEY = "key";
    public static final String SOURCE = "source";
    public static final String FACTS = "facts";
    public static final String METRICS = "metrics";
    public static final String VALIDATION = "validation";
    public static final String ANALYSIS = "analysis";
    public static final String REPORT = "report";
    public static final String FAILED_STAGE = "failedStage";

    public AnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> inputs(String runId, AnalysisKey key, SourceDocument source) {
        return Map.of(RUN_ID, runId, KEY, key, SOURCE, source);
    }

    public String getRunId() { return (String) this.data().get(RUN_ID); }
    public AnalysisKey getKey() { return (AnalysisKey) this.data().get(KEY); }
    public SourceDocument getSource() { return (SourceDocument) this.data().get(SOURCE); }
    public FinancialFacts getFacts() { return require(FACTS, FinancialFacts.class); }
    public DerivedMetrics getMetrics() { return require(METRICS, DerivedMetrics.class); }
    public ValidationReport getValidation() { return require(VALIDATION, ValidationReport.class); }
    public GuardedAnalysis getAnalysis() { return require(ANALYSIS, GuardedAnalysis.class); }
    public Optional<AnalysisReport> getReport() { return Optional.ofNullable((AnalysisReport) this.data().get(REPORT)); }

    public boolean hasFailed() {
        return this.data().containsKey(FAILED_STAGE);
    }

    // Helper for the failure update of a node
    public static Map<String, Object> failedAt(StageName stage) {
        return Map.of(FAILED_STAGE, stage.name());
    }

    private <T> T require(String key, Class<T> type) {
        Object value = this.data().get(key);
        if (!type.isInstance(value)) {
            throw new IllegalStateException("State has no " + type.getSimpleName() + " under '" + key + "'");
        }
        return type.cast(value);
    }
}

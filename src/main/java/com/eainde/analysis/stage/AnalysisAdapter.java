package com.eainde.analysis.stage;

import com.eainde.analysis.capability.CapabilityRequest;
import com.eainde.analysis.capability.CapabilityResponse;
import com.eainde.analysis.capability.JsonResponseParser;
import com.eainde.analysis.capability.StructuredCapability;
import com.eainde.analysis.error.PipelineException;
import com.eainde.analysis.error.SchemaValidationException;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.InvestorAnalysis;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.schema.ResponseSchema;
import com.eainde.analysis.schema.SchemaValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Analyze stage body: facts, metrics and consistency warnings in, guarded investor narrative out.
 */
@Log4j2
@RequiredArgsConstructor
public class AnalysisAdapter {

    private final StructuredCapability capability;
    private final PromptCatalog prompts;
    private final ResponseSchema schema;
    private final SchemaValidator validator;
    private final JsonResponseParser parser;
    private final BreakdownGuard breakdownGuard;
    private final ObjectMapper objectMapper;

    public StageOutput<GuardedAnalysis> analyze(FinancialFacts facts, DerivedMetrics metrics,
                                                ValidationReport validation, String modelId) {
        CapabilityResponse response = capability.invoke(new CapabilityRequest(modelId, prompts.systemPrompt(),
                prompts.analysisPrompt(facts, metrics, validation.warnings()), schema));

        InvestorAnalysis analysis;
        try {
            analysis = bind(response);
        } catch (PipelineException e) {
            throw e.withUsage(response.usage());
        }

        GuardedAnalysis guarded = breakdownGuard.apply(analysis, facts);
        if (!guarded.warnings().isEmpty()) {
            log.warn("Removed {} unsupported breakdown comments from the analysis", guarded.warnings().size());
        }
        return new StageOutput<>(guarded, response.usage());
    }

    private InvestorAnalysis bind(CapabilityResponse response) {
        JsonNode json = parser.parse(response.text());
        validator.requireValid(schema, json);
        try {
            return objectMapper.treeToValue(json, InvestorAnalysis.class);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Analysis response cannot be bound: " + e.getOriginalMessage(), e);
        }
    }
}

package com.eainde.analysis.stage;

import com.eainde.analysis.capability.CapabilityRequest;
import com.eainde.analysis.capability.CapabilityResponse;
import com.eainde.analysis.capability.JsonResponseParser;
import com.eainde.analysis.capability.StructuredCapability;
import com.eainde.analysis.error.PipelineException;
import com.eainde.analysis.error.SchemaValidationException;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.schema.ResponseSchema;
import com.eainde.analysis.schema.SchemaValidator;
import com.eainde.analysis.source.SourceDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Extract stage body: statement text in, validated {@link FinancialFacts} out.
 */
@Log4j2
@RequiredArgsConstructor
public class ExtractionAdapter {

    private final StructuredCapability capability;
    private final PromptCatalog prompts;
    private final ResponseSchema schema;
    private final SchemaValidator validator;
    private final JsonResponseParser parser;
    private final ObjectMapper objectMapper;

    public StageOutput<FinancialFacts> extract(SourceDocument source, String modelId) {
        CapabilityResponse response = capability.invoke(new CapabilityRequest(
                modelId, prompts.systemPrompt(), prompts.extractionPrompt(source), schema));

        FinancialFacts facts;
        try {
            facts = bind(response);
        } catch (PipelineException e) {
            throw e.withUsage(response.usage());
        }
        log.info("Extracted facts for {}: {} segments, {} other income items",
                source.subject(), facts.segments().size(), facts.otherIncome().size());
        return new StageOutput<>(facts, response.usage());
    }

    private FinancialFacts bind(CapabilityResponse response) {
        JsonNode json = parser.parse(response.text());
        validator.requireValid(schema, json);
        try {
            return objectMapper.treeToValue(json, FinancialFacts.class);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Extraction response cannot be bound: " + e.getOriginalMessage(), e);
        }
    }
}

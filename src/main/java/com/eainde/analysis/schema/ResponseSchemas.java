package com.eainde.analysis.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads the extraction and analysis response contracts from {@code schemas/} on the classpath.
 */
public class ResponseSchemas {

    private final ResponseSchema extraction;
    private final ResponseSchema analysis;

    public ResponseSchemas(ObjectMapper objectMapper) {
        this.extraction = load(objectMapper, "FinancialFacts", "schemas/extraction.json");
        this.analysis = load(objectMapper, "InvestorAnalysis", "schemas/analysis.json");
    }

    public ResponseSchema extraction() {
        return extraction;
    }

    public ResponseSchema analysis() {
        return analysis;
    }

    private static ResponseSchema load(ObjectMapper objectMapper, String name, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            JsonNode definition = objectMapper.readTree(in);
            return new ResponseSchema(name, definition, JsonSchemaConverter.toLangChainSchema(name, definition));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load response schema " + location, e);
        }
    }
}

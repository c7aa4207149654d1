package com.eainde.analysis.stage;

import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.source.SourceDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Prompt templates under {@code prompts/} on the classpath and the user prompts built from them.
 */
@Log4j2
public class PromptCatalog {

    static final String DEFAULT_SYSTEM_PROMPT = "You are a financial data extraction and analysis specialist. "
            + "Extract accurate numerical data and provide insightful analysis.";

    private static final String JSON_ONLY = "Return ONLY valid JSON, no additional text.";

    private final ObjectMapper objectMapper;
    private final String systemPrompt;
    private final String extractionTemplate;
    private final String analysisTemplate;

    public PromptCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        ClassPathResource system = new ClassPathResource("prompts/system.md");
        if (system.exists()) {
            this.systemPrompt = read(system);
        } else {
            log.warn("prompts/system.md not found, using the built-in system prompt");
            this.systemPrompt = DEFAULT_SYSTEM_PROMPT;
        }
        this.extractionTemplate = read(new ClassPathResource("prompts/extraction.md"));
        this.analysisTemplate = read(new ClassPathResource("prompts/analysis.md"));
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String extractionPrompt(SourceDocument source) {
        StringBuilder prompt = new StringBuilder(extractionTemplate).append("\n\n");
        if (source.stockPrice() != null) {
            prompt.append("Current stock price: ").append(source.stockPrice());
            if (source.currency() != null) {
                prompt.append(' ').append(source.currency());
            }
            prompt.append("\n\n");
        }
        prompt.append("Financial statement text for ").append(source.subject()).append(":\n")
                .append("<<<\n").append(source.text()).append("\n>>>\n\n")
                .append("Extract the data as structured JSON. ").append(JSON_ONLY);
        return prompt.toString();
    }

    public String analysisPrompt(FinancialFacts facts, DerivedMetrics metrics, List<Finding> warnings) {
        return analysisTemplate + "\n\n"
                + "Extracted Data:\n" + toJson(facts) + "\n\n"
                + "Calculated Metrics:\n" + toJson(metrics) + "\n\n"
                + "Consistency Warnings:\n" + toJson(warnings) + "\n\n"
                + "Provide investor-focused analysis as structured JSON. " + JSON_ONLY;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render prompt input", e);
        }
    }

    private static String read(ClassPathResource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found: " + resource.getPath(), e);
        }
    }
}

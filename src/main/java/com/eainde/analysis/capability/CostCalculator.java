package com.eainde.analysis.capability;

import com.eainde.analysis.model.UsageCounters;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Prices token usage from {@code model-pricing.json} (USD per million tokens). Models without a price
 * cost nothing and log a warning.
 */
@Log4j2
public class CostCalculator {

    private static final double MILLION = 1_000_000d;

    private final Map<String, ModelPrice> pricing;

    public CostCalculator(ObjectMapper objectMapper) {
        this(load(objectMapper));
    }

    public CostCalculator(Map<String, ModelPrice> pricing) {
        this.pricing = Map.copyOf(pricing);
    }

    public UsageCounters usage(String modelId, long promptTokens, long completionTokens, long totalTokens) {
        return new UsageCounters(promptTokens, completionTokens, totalTokens,
                cost(modelId, promptTokens, completionTokens));
    }

    public double cost(String modelId, long promptTokens, long completionTokens) {
        ModelPrice price = pricing.get(modelId);
        if (price == null) {
            log.warn("No pricing found for model: {}", modelId);
            return 0.0;
        }
        return promptTokens / MILLION * price.promptPerMillion()
                + completionTokens / MILLION * price.completionPerMillion();
    }

    private static Map<String, ModelPrice> load(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource("model-pricing.json").getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<Map<String, ModelPrice>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model-pricing.json", e);
        }
    }

    public record ModelPrice(
            @JsonProperty("prompt_tokens_per_million") double promptPerMillion,
            @JsonProperty("completion_tokens_per_million") double completionPerMillion) {
    }
}

package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Token and cost accounting of one stage, or a sum of stages.
 */
public record UsageCounters(
        @JsonProperty("prompt_tokens") long promptTokens,
        @JsonProperty("completion_tokens") long completionTokens,
        @JsonProperty("total_tokens") long totalTokens,
        @JsonProperty("cost_usd") double costUsd) implements Serializable {

    public static final UsageCounters ZERO = new UsageCounters(0, 0, 0, 0.0);

    public UsageCounters plus(UsageCounters other) {
        if (other == null) {
            return this;
        }
        return new UsageCounters(
                promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens,
                costUsd + other.costUsd);
    }
}

package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.util.List;

/**
 * Narrative produced by the analysis capability.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvestorAnalysis(
        @JsonProperty("company_type") String companyType,
        @JsonProperty("investor_summary") String investorSummary,
        @JsonProperty("red_flags") List<String> redFlags,
        @JsonProperty("growth_areas") List<String> growthAreas,
        @JsonProperty("holding_focus_areas") List<String> holdingFocusAreas,
        @JsonProperty("loss_areas") List<String> lossAreas,
        @JsonProperty("new_initiatives") List<String> newInitiatives,
        @JsonProperty("dividend_strategy") String dividendStrategy,
        @JsonProperty("investment_trend") String investmentTrend,
        @JsonProperty("segment_commentary") List<SegmentCommentary> segmentCommentary,
        @JsonProperty("other_income_commentary") List<IncomeCommentary> otherIncomeCommentary)
        implements Serializable {

    public InvestorAnalysis {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        growthAreas = growthAreas == null ? List.of() : List.copyOf(growthAreas);
        holdingFocusAreas = holdingFocusAreas == null ? List.of() : List.copyOf(holdingFocusAreas);
        lossAreas = lossAreas == null ? List.of() : List.copyOf(lossAreas);
        newInitiatives = newInitiatives == null ? List.of() : List.copyOf(newInitiatives);
        segmentCommentary = segmentCommentary == null ? List.of() : List.copyOf(segmentCommentary);
        otherIncomeCommentary = otherIncomeCommentary == null ? List.of() : List.copyOf(otherIncomeCommentary);
    }
}

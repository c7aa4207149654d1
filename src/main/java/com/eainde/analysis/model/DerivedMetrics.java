package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the calculate stage. {@code null} means the metric could not be derived from the facts.
 * Values are unrounded.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DerivedMetrics(
        @JsonProperty("shares_outstanding") Double sharesOutstanding,
        @JsonProperty("market_cap") Double marketCap,
        @JsonProperty("book_value_per_share") Double bookValuePerShare,
        @JsonProperty("pe_ratio") Double peRatio,
        @JsonProperty("pb_ratio") Double pbRatio,
        @JsonProperty("ps_ratio") Double psRatio,
        @JsonProperty("ev_ebitda") Double evEbitda,
        @JsonProperty("fcf_yield") Double fcfYield,
        @JsonProperty("revenue_growth_pct") Double revenueGrowthPct,
        @JsonProperty("net_income_growth_pct") Double netIncomeGrowthPct,
        Double roe,
        Double roa,
        @JsonProperty("debt_to_equity") Double debtToEquity,
        @JsonProperty("current_ratio") Double currentRatio,
        @JsonProperty("working_capital") Double workingCapital,
        @JsonProperty("operating_margin") Double operatingMargin,
        @JsonProperty("net_margin") Double netMargin,
        @JsonProperty("capex_pct_revenue") Double capexPctRevenue,
        @JsonProperty("payout_ratio") Double payoutRatio,
        @JsonProperty("fcf_coverage") Double fcfCoverage,
        @JsonProperty("cash_per_share") Double cashPerShare,
        @JsonProperty("debt_to_assets") Double debtToAssets,
        @JsonProperty("quick_ratio") Double quickRatio,
        @JsonProperty("gross_margin_pct") Double grossMarginPct,
        @JsonProperty("interest_coverage") Double interestCoverage,
        @JsonProperty("segment_composition") List<SegmentShare> segmentComposition,
        @JsonProperty("income_composition") List<IncomeShare> incomeComposition) implements Serializable {

    public DerivedMetrics {
        segmentComposition = segmentComposition == null ? List.of() : List.copyOf(segmentComposition);
        incomeComposition = incomeComposition == null ? List.of() : List.copyOf(incomeComposition);
    }
}

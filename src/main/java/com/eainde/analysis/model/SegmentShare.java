package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record SegmentShare(
        String name,
        @JsonProperty("revenue_share_pct") Double revenueSharePct,
        @JsonProperty("operating_income_share_pct") Double operatingIncomeSharePct) implements Serializable {
}

package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record IncomeShare(String name, @JsonProperty("net_income_share_pct") Double netIncomeSharePct)
        implements Serializable {
}

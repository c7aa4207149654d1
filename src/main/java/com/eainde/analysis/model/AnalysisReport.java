package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Final output of a run.
 */
public record AnalysisReport(
        String subject,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("fiscal_year") String fiscalYear,
        String currency,
        String text,
        List<Finding> warnings,
        UsageSummary usage) implements Serializable {

    public AnalysisReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}

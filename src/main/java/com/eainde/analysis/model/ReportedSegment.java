package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportedSegment(
        String name,
        String description,
        Double revenue,
        @JsonProperty("operating_income") Double operatingIncome) implements Serializable {
}

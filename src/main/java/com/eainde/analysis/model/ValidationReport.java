package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

public record ValidationReport(List<Finding> findings) implements Serializable {

    public ValidationReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    @JsonIgnore
    public List<Finding> warnings() {
        return findings.stream().filter(f -> !f.isContradiction()).toList();
    }

    @JsonIgnore
    public List<Finding> contradictions() {
        return findings.stream().filter(Finding::isContradiction).toList();
    }

    @JsonIgnore
    public boolean hasContradictions() {
        return findings.stream().anyMatch(Finding::isContradiction);
    }
}

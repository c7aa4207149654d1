package com.eainde.analysis.model;

import java.io.Serializable;
import java.util.List;

/**
 * Payload of the analyze stage: the narrative after unsupported breakdown commentary was removed,
 * and one warning per removal.
 */
public record GuardedAnalysis(InvestorAnalysis analysis, List<Finding> warnings) implements Serializable {

    public GuardedAnalysis {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}

package com.eainde.analysis.error;

import com.eainde.analysis.model.AnalysisKey;

public class AnalysisNotFoundException extends RuntimeException {

    public AnalysisNotFoundException(AnalysisKey key) {
        super("No analysis found for " + key.canonical());
    }
}

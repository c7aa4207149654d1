package com.eainde.analysis.controller;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of a trigger. Model ids are optional and default to {@code auto}.
 */
public record AnalysisRunRequest(
        @NotBlank(message = "subject must not be blank")
        String subject,
        String extractionModel,
        String analysisModel) {
}

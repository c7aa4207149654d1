package com.eainde.analysis.capability;

import com.eainde.analysis.schema.ResponseSchema;

public record CapabilityRequest(String modelId, String systemPrompt, String userPrompt, ResponseSchema schema) {
}

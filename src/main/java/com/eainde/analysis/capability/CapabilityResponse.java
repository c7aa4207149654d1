package com.eainde.analysis.capability;

import com.eainde.analysis.model.UsageCounters;

/**
 * Raw model output and what it cost. The text is unvalidated.
 */
public record CapabilityResponse(String text, UsageCounters usage) {
}

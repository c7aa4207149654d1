package com.eainde.analysis.capability;

import com.eainde.analysis.error.UpstreamCapabilityException;

/**
 * Prompt and response contract in, JSON text out.
 */
public interface StructuredCapability {

    /**
     * @throws UpstreamCapabilityException when the provider call fails
     */
    CapabilityResponse invoke(CapabilityRequest request);
}

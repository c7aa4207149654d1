package com.eainde.analysis.capability;

public enum CapabilityRole {
    EXTRACTION,
    ANALYSIS
}
